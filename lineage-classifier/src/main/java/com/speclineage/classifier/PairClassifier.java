/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier;

import com.speclineage.api.IOracleClient;
import com.speclineage.api.IPairClassifier;
import com.speclineage.api.exceptions.LineageException;
import com.speclineage.api.model.OracleResult;
import com.speclineage.api.model.OracleStatus;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.artifact.ArtifactStore;
import com.speclineage.classifier.smt.ComparisonFormulaBuilder;
import com.speclineage.classifier.smt.SmtScript;
import com.speclineage.classifier.smt.SmtScriptReader;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Classifies a pair of scripts with two satisfiability queries.
 *
 * <pre>
 *   Q1 = F1 and not F2      Q2 = F2 and not F1
 *
 *   Q1      Q2      label
 *   unsat   unsat   equivalent
 *   sat     sat     incomparable
 *   unsat   sat     s1_refines_s2
 *   sat     unsat   s2_refines_s1
 *   other           unknown
 * </pre>
 *
 * <p>A script that is missing, unreadable or unparseable, or a solver error on
 * either query, yields {@link RelationLabel#ERROR}. A timeout is one of the
 * "other" combinations. Failed pairs are not retried.
 */
public final class PairClassifier implements IPairClassifier {

    private static final Logger logger = Logger.getLogger(PairClassifier.class.getName());

    private final ArtifactStore artifacts;
    private final IOracleClient oracle;
    private final SmtScriptReader reader = new SmtScriptReader();
    private final ComparisonFormulaBuilder formulas = new ComparisonFormulaBuilder();

    public PairClassifier(ArtifactStore artifacts, IOracleClient oracle) {
        this.artifacts = artifacts;
        this.oracle = oracle;
    }

    @Override
    public RelationLabel classify(ScriptId first, ScriptId second) {
        SmtScript s1;
        SmtScript s2;
        try {
            s1 = reader.read(artifacts.read(first));
            s2 = reader.read(artifacts.read(second));
        } catch (LineageException e) {
            logger.warning(String.format("Cannot compare %s and %s: %s", first, second, e.getMessage()));
            return RelationLabel.ERROR;
        }

        OracleResult q1 = oracle.query(formulas.build(s1, s2));
        if (q1.status() == OracleStatus.ERROR) {
            logFailure(first, second, q1);
            return RelationLabel.ERROR;
        }
        OracleResult q2 = oracle.query(formulas.build(s2, s1));
        if (q2.status() == OracleStatus.ERROR) {
            logFailure(first, second, q2);
            return RelationLabel.ERROR;
        }

        RelationLabel label = decide(q1.status(), q2.status());
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Compared %s and %s: %s/%s -> %s",
                    first, second, q1.status(), q2.status(), label.wireName()));
        }
        return label;
    }

    /**
     * Reads the two query outcomes as a relation label.
     */
    public static RelationLabel decide(OracleStatus q1, OracleStatus q2) {
        if (q1 == OracleStatus.ERROR || q2 == OracleStatus.ERROR) {
            return RelationLabel.ERROR;
        }
        if (q1 == OracleStatus.UNSAT && q2 == OracleStatus.UNSAT) {
            return RelationLabel.EQUIVALENT;
        }
        if (q1 == OracleStatus.SAT && q2 == OracleStatus.SAT) {
            return RelationLabel.INCOMPARABLE;
        }
        if (q1 == OracleStatus.UNSAT && q2 == OracleStatus.SAT) {
            return RelationLabel.S1_REFINES_S2;
        }
        if (q1 == OracleStatus.SAT && q2 == OracleStatus.UNSAT) {
            return RelationLabel.S2_REFINES_S1;
        }
        return RelationLabel.UNKNOWN;
    }

    private static void logFailure(ScriptId first, ScriptId second, OracleResult result) {
        String output = result.combinedOutput().strip();
        if (output.length() > 200) {
            output = output.substring(0, 200) + "...";
        }
        logger.warning(String.format("Solver error comparing %s and %s: %s", first, second, output));
    }
}
