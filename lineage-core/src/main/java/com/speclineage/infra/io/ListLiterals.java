/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.io;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * List-valued table cells, written as {@code ['a', 'b']}.
 *
 * <p>Elements are plain tokens (ids, solver answers, statuses, integers);
 * commas and quotes inside elements are not supported.
 */
public final class ListLiterals {

    private ListLiterals() {
    }

    /**
     * Parses {@code ['a', 'b']}, {@code ["a"]}, {@code [1, 2]} or {@code []}.
     *
     * @throws IllegalArgumentException if the cell is not bracketed
     */
    public static List<String> parse(String cell) {
        String text = cell == null ? "" : cell.trim();
        if (!text.startsWith("[") || !text.endsWith("]")) {
            throw new IllegalArgumentException("Not a list literal: " + cell);
        }
        String body = text.substring(1, text.length() - 1).trim();
        List<String> items = new ArrayList<>();
        if (body.isEmpty()) {
            return items;
        }
        for (String part : body.split(",")) {
            String item = part.trim();
            if (item.length() >= 2 && (item.startsWith("'") || item.startsWith("\""))) {
                item = item.substring(1, item.length() - 1);
            }
            items.add(item);
        }
        return items;
    }

    /** Quoted form, {@code ['a', 'b']}. */
    public static String format(List<?> items) {
        return items.stream().map(i -> "'" + i + "'").collect(Collectors.joining(", ", "[", "]"));
    }

    /** Unquoted form for numbers, {@code [1, 2]}. */
    public static String formatNumbers(List<? extends Number> items) {
        return items.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
