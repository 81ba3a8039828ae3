/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.analysis.policy;

import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.classifier.analysis.PairAnalysisContext;
import com.speclineage.infra.config.AnalysisConfig;

import java.util.List;

/**
 * Decides whether a long-range pair needs its own classification.
 */
public interface RedundancyPolicy {

    /**
     * @param chain  members oldest first
     * @param first  index of the older script
     * @param second index of the newer script, at least {@code first + 2}
     * @param target label the current pass counts
     * @return true to skip the pair
     */
    boolean prune(PairAnalysisContext context, List<ScriptId> chain, int first, int second, RelationLabel target);

    String name();

    static RedundancyPolicy of(AnalysisConfig.PruningPolicy policy) {
        return switch (policy) {
            case NEAREST_WITNESS -> new NearestWitnessPolicy();
            case NONE -> new DirectComparisonPolicy();
        };
    }
}
