/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.chains;

import com.speclineage.api.exceptions.MalformedInputException;
import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.DerivationChain;
import com.speclineage.api.model.ScriptId;
import com.speclineage.infra.io.CsvTable;
import com.speclineage.infra.io.CsvTables;
import com.speclineage.infra.io.ListLiterals;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Persistent forms of a {@link ChainSet}.
 *
 * <ul>
 *   <li>chain table {@code {id, chain_length, derivation_chain}}, the chain
 *       joined by {@code " -> "}, newest first;</li>
 *   <li>chain list {@code {id, chain_length, derivation_chain}}, the chain as a
 *       list literal, oldest first. Pair analysis reads this one.</li>
 * </ul>
 */
public final class ChainTable {

    public static final String COL_ID = "id";
    public static final String COL_LENGTH = "chain_length";
    public static final String COL_CHAIN = "derivation_chain";
    public static final List<String> HEADER = List.of(COL_ID, COL_LENGTH, COL_CHAIN);

    private ChainTable() {
    }

    public static void write(Path file, ChainSet chains) {
        List<List<String>> rows = new ArrayList<>(chains.size());
        for (DerivationChain chain : chains) {
            rows.add(List.of(chain.head().value(), Integer.toString(chain.length()), chain.format()));
        }
        CsvTables.write(file, HEADER, rows);
    }

    public static void writeList(Path file, ChainSet chains) {
        List<List<String>> rows = new ArrayList<>(chains.size());
        for (DerivationChain chain : chains) {
            rows.add(List.of(chain.head().value(), Integer.toString(chain.length()),
                    ListLiterals.format(chain.rootFirst())));
        }
        CsvTables.write(file, HEADER, rows);
    }

    /**
     * Reads a chain table written by {@link #write(Path, ChainSet)}.
     */
    public static ChainSet read(Path file) {
        return readWith(file, cell -> List.of(cell.split(DerivationChain.SEPARATOR)), false);
    }

    /**
     * Reads a chain list written by {@link #writeList(Path, ChainSet)}.
     */
    public static ChainSet readList(Path file) {
        return readWith(file, ListLiterals::parse, true);
    }

    private interface CellParser {
        List<String> parse(String cell);
    }

    private static ChainSet readWith(Path file, CellParser parser, boolean rootFirst) {
        CsvTable table = CsvTables.read(file);
        if (!table.hasColumn(COL_CHAIN)) {
            throw new MalformedInputException(file, "missing column '" + COL_CHAIN + "'");
        }
        List<DerivationChain> chains = new ArrayList<>(table.size());
        int rowNumber = 1;
        for (Map<String, String> row : table.rows()) {
            rowNumber++;
            try {
                List<ScriptId> members = new ArrayList<>();
                for (String raw : parser.parse(row.get(COL_CHAIN))) {
                    members.add(ScriptId.parse(raw)
                            .orElseThrow(() -> new IllegalArgumentException("empty id in chain")));
                }
                if (rootFirst) {
                    Collections.reverse(members);
                }
                chains.add(new DerivationChain(members));
            } catch (IllegalArgumentException e) {
                throw new MalformedInputException(file, "row " + rowNumber + ": " + e.getMessage(), e);
            }
        }
        return new ChainSet(chains);
    }
}
