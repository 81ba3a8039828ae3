/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.io;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A CSV table held in memory: header plus rows keyed by column name.
 */
public record CsvTable(List<String> header, List<Map<String, String>> rows) {

    public CsvTable {
        header = List.copyOf(header);
        rows = List.copyOf(rows);
    }

    public static CsvTable empty(List<String> header) {
        return new CsvTable(header, List.of());
    }

    public boolean hasColumn(String column) {
        return header.contains(column);
    }

    public int size() {
        return rows.size();
    }

    public Optional<String> cell(int row, String column) {
        return Optional.ofNullable(rows.get(row).get(column));
    }
}
