/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.metrics.impl.prometheus;

import com.speclineage.infra.metrics.Counter;
import com.speclineage.infra.metrics.Gauge;
import com.speclineage.infra.metrics.MetricsRegistry;
import com.speclineage.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;

import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus implementation of MetricsRegistry.
 *
 * <p>One collector per metric name; every distinct tag combination is a labelled
 * child of it. Timer buckets span solver latencies, from milliseconds up to the
 * ten-minute default timeout.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private static final double[] SOLVER_BUCKETS = {0.01, 0.05, 0.1, 0.5, 1, 5, 30, 120, 600};

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, io.prometheus.client.Gauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, Histogram> histograms = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        io.prometheus.client.Counter collector = counters.computeIfAbsent(name, n ->
                io.prometheus.client.Counter.build()
                        .name(sanitizeName(n))
                        .help("Counter " + n)
                        .labelNames(labelNames(tags))
                        .register(registry));
        io.prometheus.client.Counter.Child child = collector.labels(labelValues(tags));
        return new Counter() {
            public void increment() { child.inc(); }

            public void increment(long amount) {
                if (amount < 0) {
                    throw new IllegalArgumentException("Counter increment amount cannot be negative: " + amount);
                }
                child.inc(amount);
            }

            public long count() { return (long) child.get(); }
        };
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        io.prometheus.client.Gauge collector = gauges.computeIfAbsent(name, n ->
                io.prometheus.client.Gauge.build()
                        .name(sanitizeName(n))
                        .help("Gauge " + n)
                        .labelNames(labelNames(tags))
                        .register(registry));
        io.prometheus.client.Gauge.Child child = collector.labels(labelValues(tags));
        return new Gauge() {
            public void set(double value) { child.set(value); }
            public double value() { return child.get(); }
        };
    }

    @Override
    public Timer timer(String name, String... tags) {
        Histogram collector = histograms.computeIfAbsent(name, n ->
                Histogram.build()
                        .name(sanitizeName(n) + "_seconds")
                        .help("Timer " + n)
                        .buckets(SOLVER_BUCKETS)
                        .labelNames(labelNames(tags))
                        .register(registry));
        Histogram.Child child = collector.labels(labelValues(tags));
        return new Timer() {
            public void record(Duration duration) { child.observe(duration.toNanos() / 1_000_000_000.0); }
            public long count() { return (long) child.get().buckets[child.get().buckets.length - 1]; }
        };
    }

    static String sanitizeName(String name) {
        return name.toLowerCase()
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String[] labelNames(String[] tags) {
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] labelValues(String[] tags) {
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }

    @Override
    public String toString() {
        return "PrometheusMetricsRegistry" + Arrays.toString(counters.keySet().toArray());
    }
}
