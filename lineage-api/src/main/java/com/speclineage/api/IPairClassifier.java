/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api;

import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;

/**
 * Classifies the semantic relation of an ordered pair of scripts.
 */
public interface IPairClassifier {

    /**
     * @param first  script playing the role of {@code s1}
     * @param second script playing the role of {@code s2}
     * @return relation label; failures degrade to {@link RelationLabel#ERROR}
     */
    RelationLabel classify(ScriptId first, ScriptId second);
}
