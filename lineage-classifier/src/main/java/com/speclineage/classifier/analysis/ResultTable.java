/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.analysis;

import com.speclineage.api.exceptions.MalformedInputException;
import com.speclineage.api.model.ScriptId;
import com.speclineage.infra.io.CsvTable;
import com.speclineage.infra.io.CsvTables;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Rows of a result table keyed by chain id. When resuming, the rows of an
 * earlier run are loaded so finished chains can be skipped and kept.
 */
final class ResultTable {

    private static final Logger logger = Logger.getLogger(ResultTable.class.getName());

    private final List<List<String>> rows;
    private final Set<String> done;

    private ResultTable(List<List<String>> rows, Set<String> done) {
        this.rows = rows;
        this.done = done;
    }

    static ResultTable open(Path output, List<String> header, boolean resume) {
        List<List<String>> rows = new ArrayList<>();
        Set<String> done = new HashSet<>();
        if (!resume || !Files.isRegularFile(output)) {
            return new ResultTable(rows, done);
        }
        CsvTable table = CsvTables.read(output);
        for (String column : header) {
            if (!table.hasColumn(column)) {
                throw new MalformedInputException(output, "missing column '" + column + "'");
            }
        }
        for (Map<String, String> row : table.rows()) {
            List<String> cells = new ArrayList<>(header.size());
            for (String column : header) {
                cells.add(row.get(column));
            }
            rows.add(cells);
            done.add(row.get(header.get(0)));
        }
        logger.info(String.format("Resuming %s: %d chains already done", output, done.size()));
        return new ResultTable(rows, done);
    }

    /** Mutable; rows appended here are written by the next checkpoint. */
    List<List<String>> rows() {
        return rows;
    }

    boolean isDone(ScriptId id) {
        return done.contains(id.value());
    }
}
