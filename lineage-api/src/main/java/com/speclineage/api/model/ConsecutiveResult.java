/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.List;

/**
 * Labels of every adjacent pair of one chain, oldest pair first.
 */
public record ConsecutiveResult(ScriptId id, List<RelationLabel> labels) {

    public ConsecutiveResult {
        labels = List.copyOf(labels);
    }
}
