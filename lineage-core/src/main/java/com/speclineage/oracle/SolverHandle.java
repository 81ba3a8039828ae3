/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.oracle;

import com.speclineage.api.model.OracleResult;
import com.speclineage.api.model.OracleStatus;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One solver process, leased from a {@link SolverProcessPool}.
 *
 * <p>Closing the handle destroys the process (if still alive) and returns the
 * lease, on every path. Use with try-with-resources.
 */
public final class SolverHandle implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(SolverHandle.class.getName());

    private static final long DRAIN_GRACE_SECONDS = 5;

    private final Process process;
    private final Executor drainExecutor;
    private final Consumer<SolverHandle> onClose;
    private boolean closed;

    SolverHandle(Process process, Executor drainExecutor, Consumer<SolverHandle> onClose) {
        this.process = process;
        this.drainExecutor = drainExecutor;
        this.onClose = onClose;
    }

    /**
     * Sends {@code input} on stdin, closes it and waits at most {@code timeout}
     * for the process to finish. The deadline runs from the call, so a solver
     * that never reads its input is killed on time as well. Standard output and
     * standard error are read separately while the solver runs.
     */
    public OracleResult exchange(String input, Duration timeout) {
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        CompletableFuture<String> stdout;
        CompletableFuture<String> stderr;
        try {
            stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), drainExecutor);
            stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()), drainExecutor);
            CompletableFuture.runAsync(() -> feed(input), drainExecutor);
        } catch (RejectedExecutionException e) {
            process.destroyForcibly();
            return OracleResult.error("solver pool is shutting down", elapsedSince(start));
        }

        try {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            if (!process.waitFor(remaining, TimeUnit.NANOSECONDS)) {
                process.destroyForcibly();
                logger.warning(String.format("Solver exceeded %ds, killed pid %d",
                        timeout.toSeconds(), process.pid()));
                return OracleResult.timeout(elapsedSince(start));
            }
            String out = stdout.get(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
            String err = stderr.get(DRAIN_GRACE_SECONDS, TimeUnit.SECONDS);
            Duration elapsed = elapsedSince(start);
            OracleStatus status = OracleOutputParser.parseStatus(out, err);
            if (status == OracleStatus.UNKNOWN && out.isBlank() && process.exitValue() != 0) {
                String message = "solver exited with code " + process.exitValue();
                return new OracleResult(OracleStatus.ERROR, message, err, elapsed);
            }
            return new OracleResult(status, out, err, elapsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return OracleResult.error("interrupted while waiting for solver", elapsedSince(start));
        } catch (ExecutionException | TimeoutException e) {
            logger.log(Level.WARNING, "Could not collect solver output", e);
            return OracleResult.error("cannot read solver output: " + e, elapsedSince(start));
        }
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public long pid() {
        return process.pid();
    }

    private void feed(String input) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input.getBytes(StandardCharsets.UTF_8));
            stdin.flush();
        } catch (IOException e) {
            // the solver may exit or be killed before reading everything, its output still counts
            logger.fine("Solver closed stdin early: " + e.getMessage());
        }
    }

    private static String drain(InputStream stream) {
        try (InputStream in = stream) {
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Solver output stream failed", e);
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    void kill() {
        if (process.isAlive()) {
            process.destroyForcibly();
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        kill();
        onClose.accept(this);
    }
}
