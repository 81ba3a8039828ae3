/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.artifact;

import com.speclineage.api.exceptions.MalformedInputException;
import com.speclineage.api.model.SolverCheckRecord;
import com.speclineage.infra.io.CsvTable;
import com.speclineage.infra.io.CsvTables;
import com.speclineage.infra.io.ListLiterals;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Standalone solver results of every script, keyed by file basename.
 *
 * <p>The {@code check} column holds a list literal such as {@code ['sat', 'unsat']},
 * or a bare token ({@code ERROR}, {@code NA}) for failed runs.
 */
public final class SolverCheckTable {

    private static final Logger logger = Logger.getLogger(SolverCheckTable.class.getName());

    public static final String COL_FILE = "file";
    public static final String COL_VALID_SPEC = "valid_spec";
    public static final String COL_CHECK = "check";
    public static final String COL_TIME_TAKEN = "time_taken";
    public static final List<String> HEADER = List.of(COL_FILE, COL_VALID_SPEC, COL_CHECK, COL_TIME_TAKEN);

    private final Map<String, SolverCheckRecord> byBasename;

    private SolverCheckTable(Map<String, SolverCheckRecord> byBasename) {
        this.byBasename = Collections.unmodifiableMap(byBasename);
    }

    public static SolverCheckTable empty() {
        return new SolverCheckTable(new LinkedHashMap<>());
    }

    public static SolverCheckTable of(Collection<SolverCheckRecord> records) {
        Map<String, SolverCheckRecord> map = new LinkedHashMap<>();
        for (SolverCheckRecord record : records) {
            map.put(record.basename(), record);
        }
        return new SolverCheckTable(map);
    }

    /**
     * Loads the table written by the bulk solver check.
     *
     * @throws MalformedInputException if the file is unreadable or lacks a required column
     */
    public static SolverCheckTable load(Path file) {
        CsvTable table = CsvTables.read(file);
        for (String column : HEADER) {
            if (!table.hasColumn(column)) {
                throw new MalformedInputException(file, "missing column '" + column + "'");
            }
        }
        List<SolverCheckRecord> records = new ArrayList<>(table.size());
        for (Map<String, String> row : table.rows()) {
            try {
                records.add(new SolverCheckRecord(
                        row.get(COL_FILE),
                        row.get(COL_VALID_SPEC),
                        parseChecks(row.get(COL_CHECK)),
                        row.get(COL_TIME_TAKEN)));
            } catch (IllegalArgumentException e) {
                throw new MalformedInputException(file, "bad row " + row, e);
            }
        }
        logger.info(String.format("Loaded %d solver check records from %s", records.size(), file));
        return of(records);
    }

    public Optional<SolverCheckRecord> get(String basename) {
        return Optional.ofNullable(byBasename.get(basename));
    }

    /**
     * True when the script has a record and that record carries an error.
     */
    public boolean hasError(String basename) {
        SolverCheckRecord record = byBasename.get(basename);
        return record != null && record.hasError();
    }

    public boolean contains(String basename) {
        return byBasename.containsKey(basename);
    }

    public Collection<SolverCheckRecord> records() {
        return byBasename.values();
    }

    public int size() {
        return byBasename.size();
    }

    /**
     * Parses {@code ['sat', 'unsat']}, {@code []}, or a bare token.
     */
    public static List<String> parseChecks(String cell) {
        if (cell == null || cell.isBlank()) {
            return List.of();
        }
        String text = cell.trim();
        return text.startsWith("[") ? ListLiterals.parse(text) : List.of(text);
    }

    /**
     * Row cells in {@link #HEADER} order.
     */
    public static List<String> toRow(SolverCheckRecord record) {
        String check;
        if (record.checks().size() == 1 && isBareToken(record.checks().get(0))) {
            check = record.checks().get(0);
        } else {
            check = ListLiterals.format(record.checks());
        }
        return List.of(record.file(), record.validSpec(), check, record.timeTaken());
    }

    private static boolean isBareToken(String token) {
        return "NA".equals(token) || SolverCheckRecord.ERROR_TOKEN.equals(token);
    }
}
