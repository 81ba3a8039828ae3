/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-label totals over a set of classified pairs.
 */
public final class LabelTally {

    private final EnumMap<RelationLabel, Long> counts = new EnumMap<>(RelationLabel.class);

    public static LabelTally of(Collection<ConsecutiveResult> results) {
        LabelTally tally = new LabelTally();
        for (ConsecutiveResult result : results) {
            result.labels().forEach(tally::add);
        }
        return tally;
    }

    public void add(RelationLabel label) {
        counts.merge(label, 1L, Long::sum);
    }

    public long count(RelationLabel label) {
        return counts.getOrDefault(label, 0L);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    public double percentage(RelationLabel label) {
        long total = total();
        return total == 0 ? 0.0 : (double) count(label) / total * 100.0;
    }

    public Map<RelationLabel, Long> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    public String format() {
        StringBuilder sb = new StringBuilder("Total: ").append(total());
        for (RelationLabel label : RelationLabel.values()) {
            sb.append(String.format("%n  %s: %d (%.2f%%)", label.wireName(), count(label), percentage(label)));
        }
        return sb.toString();
    }
}
