/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api;

import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.EdgeTable;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for turning a parent-pointer table into maximal derivation chains.
 */
public interface IChainBuilder {

    /**
     * Builds one ancestry chain per id and drops chains whose members are
     * contained in another chain.
     *
     * @param edges id to parent table
     * @return maximal chains, deterministic for a given table
     */
    ChainSet buildChains(EdgeTable edges);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
