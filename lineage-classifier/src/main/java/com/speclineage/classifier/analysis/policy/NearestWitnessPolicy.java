/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.analysis.policy;

import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.classifier.analysis.PairAnalysisContext;

import java.util.List;

/**
 * Skips {@code (i, j)} when an adjacent pair {@code (k-1, k)} with
 * {@code i < k < j} already carries the target label, or when one of those
 * intermediate scripts is missing or failed its standalone check.
 *
 * <p>This is a heuristic: the long-range relation is taken as already counted
 * through the shorter witness, which labels do not in general guarantee. The
 * last adjacent pair of the span, {@code (j-1, j)}, is not inspected.
 */
public final class NearestWitnessPolicy implements RedundancyPolicy {

    @Override
    public boolean prune(PairAnalysisContext context, List<ScriptId> chain, int first, int second,
                         RelationLabel target) {
        for (int k = first + 1; k < second; k++) {
            ScriptId older = chain.get(k - 1);
            ScriptId newer = chain.get(k);
            if (!context.isUsable(older) || !context.isUsable(newer)) {
                return true;
            }
            if (context.classify(older, newer) == target) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String name() {
        return "nearest-witness";
    }
}
