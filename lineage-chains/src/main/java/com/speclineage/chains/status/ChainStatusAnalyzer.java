/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.chains.status;

import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.ChainStatus;
import com.speclineage.api.model.ChainStatusRow;
import com.speclineage.api.model.DerivationChain;
import com.speclineage.api.model.ScriptId;
import com.speclineage.api.model.SolverCheckRecord;
import com.speclineage.artifact.SolverCheckTable;
import com.speclineage.infra.io.CsvTables;
import com.speclineage.infra.io.ListLiterals;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Standalone solver status along every chain, and how many revisions it took
 * to leave an erroring or unsatisfiable state.
 *
 * <p>Only records of valid scripts are consulted; members without one count
 * as {@link ChainStatus#NO_CHECK}.
 */
public final class ChainStatusAnalyzer {

    private static final Logger logger = Logger.getLogger(ChainStatusAnalyzer.class.getName());

    public static final List<String> STATUS_HEADER = List.of("id", "derivation_chain", "status_chain");
    public static final List<String> STEPS_HEADER = List.of(
            "id", "derivation_chain", "status_chain", "parseerror_fix_steps", "unsat_to_sat_steps");

    private final SolverCheckTable checks;
    private final Function<ScriptId, String> fileName;

    /**
     * @param checks   standalone solver results
     * @param fileName maps a script id to the basename its record is keyed by
     */
    public ChainStatusAnalyzer(SolverCheckTable checks, Function<ScriptId, String> fileName) {
        this.checks = checks;
        this.fileName = fileName;
    }

    public List<ChainStatusRow> analyze(ChainSet chains) {
        List<ChainStatusRow> rows = new ArrayList<>(chains.size());
        for (DerivationChain chain : chains) {
            rows.add(analyze(chain));
        }
        logger.info(String.format("Computed status chains for %d chains", rows.size()));
        return rows;
    }

    public ChainStatusRow analyze(DerivationChain chain) {
        List<ScriptId> members = chain.rootFirst();
        List<ChainStatus> statuses = new ArrayList<>(members.size());
        for (ScriptId member : members) {
            SolverCheckRecord record = checks.get(fileName.apply(member))
                    .filter(SolverCheckRecord::isValidSpec)
                    .orElse(null);
            statuses.add(ChainStatus.of(record));
        }
        return new ChainStatusRow(chain.head(), members, statuses,
                parseErrorFixSteps(statuses), unsatToSatSteps(statuses));
    }

    /**
     * For each run of {@code ERROR}, the distance from its first member to the
     * next non-error revision. Runs never fixed contribute nothing.
     */
    public static List<Integer> parseErrorFixSteps(List<ChainStatus> statuses) {
        List<Integer> steps = new ArrayList<>();
        int i = 0;
        while (i < statuses.size()) {
            if (statuses.get(i) == ChainStatus.ERROR) {
                int start = i;
                while (i + 1 < statuses.size() && statuses.get(i + 1) == ChainStatus.ERROR) {
                    i++;
                }
                if (i + 1 < statuses.size()) {
                    steps.add(i + 1 - start);
                }
            }
            i++;
        }
        return steps;
    }

    /**
     * For each run of {@code UNSAT}, the distance from its last member to the
     * next {@code SAT} revision, if there is one.
     */
    public static List<Integer> unsatToSatSteps(List<ChainStatus> statuses) {
        List<Integer> steps = new ArrayList<>();
        int i = 0;
        while (i < statuses.size()) {
            if (statuses.get(i) == ChainStatus.UNSAT) {
                while (i + 1 < statuses.size() && statuses.get(i + 1) == ChainStatus.UNSAT) {
                    i++;
                }
                for (int j = i + 1; j < statuses.size(); j++) {
                    if (statuses.get(j) == ChainStatus.SAT) {
                        steps.add(j - i);
                        break;
                    }
                }
            }
            i++;
        }
        return steps;
    }

    public static void writeStatusTable(Path file, List<ChainStatusRow> rows) {
        List<List<String>> cells = new ArrayList<>(rows.size());
        for (ChainStatusRow row : rows) {
            cells.add(List.of(row.id().value(), ListLiterals.format(row.chain()), ListLiterals.format(row.statuses())));
        }
        CsvTables.write(file, STATUS_HEADER, cells);
    }

    public static void writeStepsTable(Path file, List<ChainStatusRow> rows) {
        List<List<String>> cells = new ArrayList<>(rows.size());
        for (ChainStatusRow row : rows) {
            cells.add(List.of(row.id().value(), ListLiterals.format(row.chain()), ListLiterals.format(row.statuses()),
                    ListLiterals.formatNumbers(row.parseErrorFixSteps()),
                    ListLiterals.formatNumbers(row.unsatToSatSteps())));
        }
        CsvTables.write(file, STEPS_HEADER, cells);
    }

    /**
     * Share of chains with at least one invalid script, and with no valid script
     * at all, ignoring {@code UNKNOWN} members.
     */
    public static StatusOverview overview(List<ChainStatusRow> rows) {
        int withInvalid = 0;
        int withoutValid = 0;
        for (ChainStatusRow row : rows) {
            List<ChainStatus> known = row.statuses().stream()
                    .filter(s -> s != ChainStatus.UNKNOWN)
                    .toList();
            if (known.contains(ChainStatus.ERROR)) {
                withInvalid++;
            }
            if (known.stream().allMatch(s -> s == ChainStatus.ERROR)) {
                withoutValid++;
            }
        }
        return new StatusOverview(rows.size(), withInvalid, withoutValid);
    }

    public record StatusOverview(int chains, int withInvalidScripts, int withoutValidScripts) {

        public double withInvalidPercent() {
            return chains == 0 ? 0.0 : withInvalidScripts * 100.0 / chains;
        }

        public double withoutValidPercent() {
            return chains == 0 ? 0.0 : withoutValidScripts * 100.0 / chains;
        }

        public String format() {
            return String.format("Edit paths=%d, with invalid scripts=%.2f%%, without valid scripts=%.2f%%",
                    chains, withInvalidPercent(), withoutValidPercent());
        }
    }
}
