/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

/**
 * Standalone solver status of one chain member.
 */
public enum ChainStatus {
    SAT,
    UNSAT,
    UNKNOWN,
    ERROR,
    /** The script has no check-sat command, or was never checked. */
    NO_CHECK,
    MULTIPLE_CHECKS;

    public static ChainStatus of(SolverCheckRecord record) {
        if (record == null || record.checks().isEmpty()) {
            return NO_CHECK;
        }
        if (record.checks().size() > 1) {
            return MULTIPLE_CHECKS;
        }
        return switch (record.checks().get(0)) {
            case SolverCheckRecord.ERROR_TOKEN -> ERROR;
            case "sat" -> SAT;
            case "unsat" -> UNSAT;
            default -> UNKNOWN;
        };
    }
}
