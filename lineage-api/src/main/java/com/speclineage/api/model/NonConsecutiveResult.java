/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.List;

/**
 * Outcome of one single-label pass over one chain.
 *
 * @param id          chain id (its starting script)
 * @param chain       the chain in chronological order
 * @param targetLabel label the pass was counting
 * @param count       number of directly classified pairs carrying the target label
 * @param pairs       those pairs, in enumeration order
 * @param skipped     candidate pairs not classified directly (errored endpoint or pruned)
 * @param compared    candidate pairs that were classified directly
 */
public record NonConsecutiveResult(
    ScriptId id,
    List<ScriptId> chain,
    RelationLabel targetLabel,
    int count,
    List<IndexPair> pairs,
    List<IndexPair> skipped,
    int compared
) {
    public NonConsecutiveResult {
        chain = List.copyOf(chain);
        pairs = List.copyOf(pairs);
        skipped = List.copyOf(skipped);
    }

    public boolean wasSkipped(int first, int second) {
        return skipped.contains(new IndexPair(first, second));
    }
}
