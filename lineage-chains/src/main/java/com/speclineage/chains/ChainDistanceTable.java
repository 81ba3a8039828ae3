/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.chains;

import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.DerivationChain;
import com.speclineage.api.model.ScriptId;
import com.speclineage.artifact.ArtifactStore;
import com.speclineage.infra.io.CsvTables;
import com.speclineage.infra.io.ListLiterals;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Character edit distance between consecutive revisions of each chain.
 *
 * <p>Only chains of at least three members are listed. Distances run oldest
 * pair first; a revision without an artifact counts as empty text.
 */
public final class ChainDistanceTable {

    private static final Logger logger = Logger.getLogger(ChainDistanceTable.class.getName());

    public static final String OUTPUT_FILE = "fmp_edit_paths_chain_levenshtein.csv";
    public static final List<String> HEADER = List.of("id", "chain_len", "distances");

    private static final int MIN_CHAIN_LENGTH = 3;

    private final ArtifactStore artifacts;
    private final LevenshteinDistance distance = LevenshteinDistance.getDefaultInstance();

    public ChainDistanceTable(ArtifactStore artifacts) {
        this.artifacts = artifacts;
    }

    public List<Integer> distances(DerivationChain chain) {
        List<ScriptId> members = chain.rootFirst();
        List<Integer> distances = new ArrayList<>(Math.max(0, members.size() - 1));
        String previous = textOf(members.get(0));
        for (int i = 1; i < members.size(); i++) {
            String current = textOf(members.get(i));
            distances.add(distance.apply(previous, current));
            previous = current;
        }
        return distances;
    }

    /**
     * Computes the distances of every eligible chain and writes {@code output}.
     *
     * @return number of rows written
     */
    public int write(ChainSet chains, Path output) {
        List<List<String>> rows = new ArrayList<>();
        for (DerivationChain chain : chains) {
            if (chain.length() < MIN_CHAIN_LENGTH) {
                continue;
            }
            List<Integer> distances = distances(chain);
            rows.add(List.of(chain.head().value(), Integer.toString(chain.length()),
                    ListLiterals.formatNumbers(distances)));
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Chain %s distances %s", chain.head(), distances));
            }
        }
        CsvTables.write(output, HEADER, rows);
        logger.info(String.format("Wrote edit distances of %d chains to %s", rows.size(), output));
        return rows.size();
    }

    private String textOf(ScriptId id) {
        return artifacts.exists(id) ? artifacts.read(id) : "";
    }
}
