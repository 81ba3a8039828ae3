/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.metrics.impl.prometheus;

import com.speclineage.infra.metrics.MetricsRegistry;
import com.speclineage.infra.metrics.api.MetricsRegistryProvider;

/**
 * Prometheus-backed metrics provider, registered by the command-line module.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
