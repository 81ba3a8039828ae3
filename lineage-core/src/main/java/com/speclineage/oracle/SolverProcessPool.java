/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.oracle;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.speclineage.api.exceptions.OracleFailureException;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Bounded supply of solver processes.
 *
 * <p>At most {@code maxProcesses} solvers run at once; {@link #acquire()} blocks
 * until a slot frees up. Every process is started fresh for one exchange and is
 * destroyed when its handle closes. {@link #close()} kills whatever is still
 * running and refuses further leases.
 */
public final class SolverProcessPool implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(SolverProcessPool.class.getName());

    private final List<String> command;
    private final int maxProcesses;
    private final Semaphore slots;
    private final Set<SolverHandle> live = ConcurrentHashMap.newKeySet();
    private final ExecutorService drainExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SolverProcessPool(List<String> command, int maxProcesses) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Solver command cannot be empty");
        }
        if (maxProcesses < 1) {
            throw new IllegalArgumentException("maxProcesses must be at least 1, got: " + maxProcesses);
        }
        this.command = List.copyOf(command);
        this.maxProcesses = maxProcesses;
        this.slots = new Semaphore(maxProcesses, true);
        this.drainExecutor = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder()
                        .setNameFormat("solver-output-%d")
                        .setDaemon(true)
                        .build());
        logger.info(String.format("SolverProcessPool initialized: command=%s, maxProcesses=%d",
                String.join(" ", command), maxProcesses));
    }

    /**
     * Starts a solver once a slot is available.
     *
     * @throws InterruptedException   if interrupted while waiting for a slot
     * @throws OracleFailureException if the pool is closed or the process cannot start
     */
    public SolverHandle acquire() throws InterruptedException {
        if (closed.get()) {
            throw new OracleFailureException("Solver pool is closed");
        }
        slots.acquire();
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            slots.release();
            throw new OracleFailureException("Cannot start solver '" + String.join(" ", command) + "'", e);
        }
        SolverHandle handle = new SolverHandle(process, drainExecutor, this::release);
        live.add(handle);
        if (closed.get()) {
            handle.close();
            throw new OracleFailureException("Solver pool is closed");
        }
        return handle;
    }

    private void release(SolverHandle handle) {
        live.remove(handle);
        slots.release();
    }

    public int maxProcesses() {
        return maxProcesses;
    }

    public int inUse() {
        return maxProcesses - slots.availablePermits();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Kills every running solver. Handles already leased still return their slot
     * when closed.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            int killed = 0;
            for (SolverHandle handle : live) {
                if (handle.isAlive()) {
                    handle.kill();
                    killed++;
                }
            }
            drainExecutor.shutdownNow();
            logger.info(String.format("SolverProcessPool closed, killed %d running solvers", killed));
        }
    }
}
