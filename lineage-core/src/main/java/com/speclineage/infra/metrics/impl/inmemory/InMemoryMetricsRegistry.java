/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.metrics.impl.inmemory;

import com.speclineage.infra.metrics.Counter;
import com.speclineage.infra.metrics.Gauge;
import com.speclineage.infra.metrics.MetricsRegistry;
import com.speclineage.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry that keeps every value in memory so tests can assert on it.
 * Metrics are keyed by name plus tags.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), k -> new InMemoryCounter());
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(key(name, tags), k -> new InMemoryGauge());
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), k -> new InMemoryTimer());
    }

    /** Test helper: value of a counter, 0 if it was never created. */
    public long counterValue(String name, String... tags) {
        InMemoryCounter counter = counters.get(key(name, tags));
        return counter == null ? 0L : counter.count();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }

    private static String key(String name, String... tags) {
        return tags.length == 0 ? name : name + String.join(",", tags);
    }

    static final class InMemoryCounter implements Counter {
        private final AtomicLong value = new AtomicLong();

        public void increment() { value.incrementAndGet(); }
        public void increment(long amount) { value.addAndGet(amount); }
        public long count() { return value.get(); }
    }

    static final class InMemoryGauge implements Gauge {
        private volatile double value;

        public void set(double v) { value = v; }
        public double value() { return value; }
    }

    static final class InMemoryTimer implements Timer {
        private final List<Duration> recordings = new CopyOnWriteArrayList<>();

        public void record(Duration duration) {
            if (duration.isNegative()) {
                throw new IllegalArgumentException("Cannot record negative duration: " + duration);
            }
            recordings.add(duration);
        }

        public long count() { return recordings.size(); }
    }
}
