/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Normalized answer of the external solver.
 *
 * @param status      closed outcome set
 * @param rawOutput   what the solver printed on standard output, or the failure text
 * @param errorOutput what the solver printed on standard error
 * @param elapsed     wall-clock time of the exchange
 */
public record OracleResult(OracleStatus status, String rawOutput, String errorOutput, Duration elapsed) {

    public OracleResult {
        Objects.requireNonNull(status, "status");
        rawOutput = rawOutput == null ? "" : rawOutput;
        errorOutput = errorOutput == null ? "" : errorOutput;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public OracleResult(OracleStatus status, String rawOutput, Duration elapsed) {
        this(status, rawOutput, "", elapsed);
    }

    public static OracleResult timeout(Duration elapsed) {
        return new OracleResult(OracleStatus.TIMEOUT, "", elapsed);
    }

    public static OracleResult error(String message, Duration elapsed) {
        return new OracleResult(OracleStatus.ERROR, message, elapsed);
    }

    public boolean isFailure() {
        return status == OracleStatus.ERROR || status == OracleStatus.TIMEOUT;
    }

    /**
     * Both streams as the solver wrote them, standard output first.
     */
    public String combinedOutput() {
        return rawOutput + errorOutput;
    }
}
