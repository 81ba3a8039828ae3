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
 * Classifies every candidate pair.
 */
public final class DirectComparisonPolicy implements RedundancyPolicy {

    @Override
    public boolean prune(PairAnalysisContext context, List<ScriptId> chain, int first, int second,
                         RelationLabel target) {
        return false;
    }

    @Override
    public String name() {
        return "direct";
    }
}
