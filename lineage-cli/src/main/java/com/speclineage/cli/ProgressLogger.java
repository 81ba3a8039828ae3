/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.cli;

import com.speclineage.api.AnalysisListener;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs pass progress roughly every tenth of the chains.
 */
final class ProgressLogger implements AnalysisListener {

    private static final Logger logger = Logger.getLogger(ProgressLogger.class.getName());

    private int step = 1;

    @Override
    public void onPassStart(String pass, int total) {
        step = Math.max(1, total / 10);
        logger.info(String.format("%s: starting, %d chains", pass, total));
    }

    @Override
    public void onPairClassified(ScriptId first, ScriptId second, RelationLabel label) {
        if (logger.isLoggable(Level.FINER)) {
            logger.finer(String.format("%s vs %s: %s", first, second, label.wireName()));
        }
    }

    @Override
    public void onChainComplete(String pass, ScriptId chainId, int done, int total) {
        if (done % step == 0 || done == total) {
            logger.info(String.format("%s: %d/%d chains", pass, done, total));
        }
    }

    @Override
    public void onCheckpoint(String pass, int comparisons) {
        logger.fine(String.format("%s: checkpoint after %d comparisons", pass, comparisons));
    }
}
