/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.metrics.impl.inmemory;

import com.speclineage.infra.metrics.MetricsRegistry;
import com.speclineage.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider for tests. Registered from
 * {@code src/test/resources/META-INF/services}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
