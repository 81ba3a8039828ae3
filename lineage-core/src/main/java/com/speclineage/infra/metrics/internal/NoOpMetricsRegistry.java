/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.metrics.internal;

import com.speclineage.infra.metrics.Counter;
import com.speclineage.infra.metrics.Gauge;
import com.speclineage.infra.metrics.MetricsRegistry;
import com.speclineage.infra.metrics.Timer;

import java.time.Duration;

/**
 * Fallback used when no provider is configured.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter NO_OP_COUNTER = new Counter() {
        public void increment() {}
        public void increment(long amount) {}
        public long count() { return 0L; }
    };

    private static final Gauge NO_OP_GAUGE = new Gauge() {
        public void set(double value) {}
        public double value() { return 0.0; }
    };

    private static final Timer NO_OP_TIMER = new Timer() {
        public void record(Duration duration) {}
        public long count() { return 0L; }
    };

    @Override
    public Counter counter(String name, String... tags) {
        return NO_OP_COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return NO_OP_GAUGE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return NO_OP_TIMER;
    }
}
