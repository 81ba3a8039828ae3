/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.metrics;

import java.time.Duration;

/**
 * Latency recorder for solver exchanges and analysis passes.
 * Thread-safe.
 */
public interface Timer {

    /**
     * Records a pre-measured duration.
     */
    void record(Duration duration);

    /**
     * Number of recorded durations.
     */
    long count();
}
