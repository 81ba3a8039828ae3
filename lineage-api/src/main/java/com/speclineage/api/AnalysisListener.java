/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api;

import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;

/**
 * Progress callbacks of a long-running classification batch.
 *
 * <p>All methods have empty defaults; implement only what you need.
 *
 * <h2>Usage</h2>
 * <pre>
 * analyzer.setListener(new AnalysisListener() {
 *     {@literal @}Override
 *     public void onChainComplete(String pass, ScriptId chainId, int done, int total) {
 *         System.out.printf("%s: %d/%d%n", pass, done, total);
 *     }
 * });
 * </pre>
 */
public interface AnalysisListener {

    AnalysisListener NONE = new AnalysisListener() {
    };

    /**
     * Called before the first chain of a pass.
     *
     * @param pass  pass name, e.g. {@code "non-consecutive:equivalent"}
     * @param total number of chains the pass will visit
     */
    default void onPassStart(String pass, int total) {
    }

    /**
     * Called after each direct classification.
     */
    default void onPairClassified(ScriptId first, ScriptId second, RelationLabel label) {
    }

    /**
     * Called after each chain of a pass.
     */
    default void onChainComplete(String pass, ScriptId chainId, int done, int total) {
    }

    /**
     * Called after a checkpoint has been written.
     */
    default void onCheckpoint(String pass, int comparisons) {
    }
}
