/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

/**
 * Outcome of a single oracle query.
 */
public enum OracleStatus {
    SAT,
    UNSAT,
    UNKNOWN,
    ERROR,
    TIMEOUT;

    /** True for the three answers the solver itself can give. */
    public boolean isTerminal() {
        return this == SAT || this == UNSAT || this == UNKNOWN;
    }
}
