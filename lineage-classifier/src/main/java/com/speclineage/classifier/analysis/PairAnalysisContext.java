/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.analysis;

import com.speclineage.api.AnalysisListener;
import com.speclineage.api.IPairClassifier;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.artifact.ArtifactStore;
import com.speclineage.artifact.SolverCheckTable;

/**
 * Read-only view of a run shared by the analyzers and pruning policies:
 * artifacts, the standalone check table and the (memoized) classifier.
 */
public final class PairAnalysisContext {

    private final ArtifactStore artifacts;
    private final SolverCheckTable checks;
    private final IPairClassifier classifier;
    private final AnalysisListener listener;

    public PairAnalysisContext(ArtifactStore artifacts, SolverCheckTable checks,
                               IPairClassifier classifier, AnalysisListener listener) {
        this.artifacts = artifacts;
        this.checks = checks;
        this.classifier = classifier;
        this.listener = listener == null ? AnalysisListener.NONE : listener;
    }

    public boolean exists(ScriptId id) {
        return artifacts.exists(id);
    }

    /** True when the standalone check of {@code id} reported an error. */
    public boolean hasErrorRecord(ScriptId id) {
        return checks.hasError(artifacts.fileNameOf(id));
    }

    /** Present and not flagged by the standalone check. */
    public boolean isUsable(ScriptId id) {
        return exists(id) && !hasErrorRecord(id);
    }

    public RelationLabel classify(ScriptId first, ScriptId second) {
        RelationLabel label = classifier.classify(first, second);
        listener.onPairClassified(first, second, label);
        return label;
    }

    public AnalysisListener listener() {
        return listener;
    }
}
