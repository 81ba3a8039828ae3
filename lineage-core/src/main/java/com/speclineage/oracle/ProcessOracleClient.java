/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.oracle;

import com.speclineage.api.IOracleClient;
import com.speclineage.api.exceptions.OracleFailureException;
import com.speclineage.api.model.OracleResult;
import com.speclineage.api.model.OracleStatus;
import com.speclineage.infra.config.AnalysisConfig;
import com.speclineage.infra.lifecycle.CancellationToken;
import com.speclineage.infra.metrics.MetricsRegistry;

import java.time.Duration;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link IOracleClient} that runs every query in a fresh solver process from a
 * {@link SolverProcessPool}.
 *
 * <p>Thread-safe; concurrency is bounded by the pool. Never throws for
 * solver-side problems: a process that cannot start, dies, or is interrupted
 * yields an {@code ERROR} result, and one that overruns its timeout is killed
 * and yields {@code TIMEOUT}.
 */
public final class ProcessOracleClient implements IOracleClient, AutoCloseable {

    private static final Logger logger = Logger.getLogger(ProcessOracleClient.class.getName());

    static final String METRIC_QUERIES = "oracle_queries_total";
    static final String METRIC_LATENCY = "oracle_query_duration";

    private final SolverProcessPool pool;
    private final Duration defaultTimeout;
    private final CancellationToken cancellation;
    private final MetricsRegistry metrics;

    public ProcessOracleClient(SolverProcessPool pool, Duration defaultTimeout,
                               CancellationToken cancellation, MetricsRegistry metrics) {
        this.pool = pool;
        this.defaultTimeout = defaultTimeout;
        this.cancellation = cancellation;
        this.metrics = metrics;
    }

    public static ProcessOracleClient fromConfig(AnalysisConfig config, CancellationToken cancellation) {
        SolverProcessPool pool = new SolverProcessPool(config.getSolverCommand(), config.getMaxSolverProcesses());
        return new ProcessOracleClient(pool, config.getSolverTimeout(), cancellation, MetricsRegistry.getInstance());
    }

    @Override
    public OracleResult query(String formula) {
        return query(formula, defaultTimeout);
    }

    @Override
    public OracleResult query(String formula, Duration timeout) {
        OracleResult result = exchange(formula, timeout);
        record(result);
        return result;
    }

    private OracleResult exchange(String formula, Duration timeout) {
        if (cancellation.isCancelled()) {
            return OracleResult.error("cancelled: " + cancellation.reason(), Duration.ZERO);
        }
        try (SolverHandle handle = pool.acquire()) {
            OracleResult result = handle.exchange(formula, timeout);
            if (logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Solver pid %d answered %s in %dms",
                        handle.pid(), result.status(), result.elapsed().toMillis()));
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OracleResult.error("interrupted while waiting for a solver slot", Duration.ZERO);
        } catch (OracleFailureException e) {
            logger.log(Level.WARNING, "Solver query failed", e);
            return OracleResult.error(e.getMessage(), Duration.ZERO);
        }
    }

    private void record(OracleResult result) {
        metrics.counter(METRIC_QUERIES, "status", result.status().name().toLowerCase(Locale.ROOT)).increment();
        if (result.status() != OracleStatus.ERROR) {
            metrics.timer(METRIC_LATENCY).record(result.elapsed());
        }
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    /**
     * Closes the pool, killing any solver still running.
     */
    @Override
    public void close() {
        pool.close();
    }
}
