/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api;

import com.speclineage.api.model.OracleResult;

import java.time.Duration;

/**
 * A single request/response exchange with the external decision procedure.
 *
 * <p>Implementations never throw for solver-side problems: timeouts and
 * transport failures come back as {@code TIMEOUT} and {@code ERROR} results.
 */
public interface IOracleClient {

    /**
     * Submits {@code formula} and waits at most {@code timeout} for an answer.
     */
    OracleResult query(String formula, Duration timeout);

    /**
     * Same as {@link #query(String, Duration)} with the client's configured timeout.
     */
    OracleResult query(String formula);
}
