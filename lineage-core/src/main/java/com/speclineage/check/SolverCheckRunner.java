/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.check;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.speclineage.api.IOracleClient;
import com.speclineage.api.exceptions.LineageException;
import com.speclineage.api.model.OracleResult;
import com.speclineage.api.model.OracleStatus;
import com.speclineage.api.model.SolverCheckRecord;
import com.speclineage.artifact.ArtifactStore;
import com.speclineage.artifact.SolverCheckTable;
import com.speclineage.infra.config.AnalysisConfig;
import com.speclineage.infra.io.CsvTables;
import com.speclineage.infra.lifecycle.CancellationToken;
import com.speclineage.oracle.OracleOutputParser;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Runs every script of a directory through the solver on its own and records
 * what it answered.
 *
 * <p>Scripts are processed in batches on a fixed worker pool; each finished
 * batch is appended to the results table, so an interrupted run keeps every
 * completed batch. Completion order inside a batch does not matter, rows are
 * keyed by file path.
 *
 * <p>What the solver printed for a script, both streams, is kept in the output
 * directory as {@code <name>.txt}. Scripts that timed out or never reached
 * the solver leave no output file.
 */
public final class SolverCheckRunner {

    private static final Logger logger = Logger.getLogger(SolverCheckRunner.class.getName());

    private static final Pattern COMMAND = Pattern.compile("\\(\\s*(assert|declare-|check-)");

    public static final String TIMEOUT_TOKEN = "NA";
    public static final String TIMEOUT_TIME = "TO";

    private final IOracleClient oracle;
    private final Path outputDir;
    private final int workers;
    private final int batchSize;
    private final boolean resume;
    private final CancellationToken cancellation;
    private Tracer tracer = OpenTelemetry.noop().getTracer("speclineage");

    public SolverCheckRunner(IOracleClient oracle, AnalysisConfig config, CancellationToken cancellation) {
        this.oracle = oracle;
        this.outputDir = config.getOutputDir();
        this.workers = config.getCheckWorkers();
        this.batchSize = config.getCheckBatchSize();
        this.resume = config.isResume();
        this.cancellation = cancellation;
    }

    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Checks every artifact of {@code scripts} and writes {@code output}.
     *
     * @return records produced by this run (not those kept from a resumed table)
     */
    public List<SolverCheckRecord> run(ArtifactStore scripts, Path output) {
        Span span = tracer.spanBuilder("check-scripts").startSpan();
        try (Scope scope = span.makeCurrent()) {
            List<Path> files = pending(scripts.listAll(), output);
            span.setAttribute("scripts", files.size());
            logger.info(String.format("Checking %d scripts under %s with %d workers",
                    files.size(), scripts.baseDir(), workers));

            List<SolverCheckRecord> produced = new ArrayList<>(files.size());
            ExecutorService executor = Executors.newFixedThreadPool(workers,
                    new ThreadFactoryBuilder()
                            .setNameFormat("solver-check-%d")
                            .setDaemon(true)
                            .build());
            try {
                for (int from = 0; from < files.size(); from += batchSize) {
                    if (cancellation.isCancelled()) {
                        logger.warning(String.format("Stopping after %d of %d scripts: %s",
                                produced.size(), files.size(), cancellation.reason()));
                        break;
                    }
                    List<Path> batch = files.subList(from, Math.min(from + batchSize, files.size()));
                    List<SolverCheckRecord> results = runBatch(executor, batch);
                    CsvTables.append(output, SolverCheckTable.HEADER,
                            results.stream().map(SolverCheckTable::toRow).toList());
                    produced.addAll(results);
                    logger.info(String.format("Checked %d/%d scripts", from + batch.size(), files.size()));
                }
            } finally {
                shutdown(executor);
            }
            span.setAttribute("checked", produced.size());
            return produced;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private List<Path> pending(List<Path> all, Path output) {
        if (!Files.exists(output)) {
            return all;
        }
        if (!resume) {
            try {
                Files.delete(output);
            } catch (IOException e) {
                throw new LineageException("Cannot replace " + output, e);
            }
            return all;
        }
        Set<String> done = new HashSet<>();
        SolverCheckTable.load(output).records().forEach(r -> done.add(r.file()));
        List<Path> remaining = all.stream().filter(p -> !done.contains(p.toString())).toList();
        logger.info(String.format("Resuming: %d scripts already checked, %d remaining",
                all.size() - remaining.size(), remaining.size()));
        return remaining;
    }

    private List<SolverCheckRecord> runBatch(ExecutorService executor, List<Path> batch) {
        List<Future<SolverCheckRecord>> futures = new ArrayList<>(batch.size());
        for (Path file : batch) {
            futures.add(executor.submit(() -> check(file)));
        }
        List<SolverCheckRecord> results = new ArrayList<>(batch.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                SolverCheckRecord record = futures.get(i).get();
                if (record != null) {
                    results.add(record);
                }
            } catch (ExecutionException e) {
                logger.log(Level.SEVERE, "Error processing file " + batch.get(i), e.getCause());
                results.add(new SolverCheckRecord(batch.get(i).toString(),
                        SolverCheckRecord.ERROR_TOKEN, List.of(SolverCheckRecord.ERROR_TOKEN), TIMEOUT_TOKEN));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel("interrupted");
                break;
            }
        }
        return results;
    }

    /**
     * Checks one script. Returns {@code null} when the run was cancelled before
     * the script finished; such a script is left for a resumed run.
     */
    SolverCheckRecord check(Path file) {
        if (cancellation.isCancelled()) {
            return null;
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warning("Cannot read " + file + ": " + e.getMessage());
            return new SolverCheckRecord(file.toString(), SolverCheckRecord.ERROR_TOKEN,
                    List.of(SolverCheckRecord.ERROR_TOKEN), e.getMessage());
        }
        OracleResult result = oracle.query(text);
        if (cancellation.isCancelled()) {
            logger.fine(String.format("Discarding %s answer for %s: %s",
                    result.status(), file, cancellation.reason()));
            return null;
        }
        saveOutput(file, result);
        SolverCheckRecord record = toRecord(file.toString(), text, result);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("File: %s, Valid Spec: %s, Result: %s, Time Taken: %s",
                    file, record.validSpec(), record.checks(), record.timeTaken()));
        }
        return record;
    }

    private void saveOutput(Path file, OracleResult result) {
        boolean answered = result.status() != OracleStatus.TIMEOUT
                && (result.status() != OracleStatus.ERROR || OracleOutputParser.hasError(result));
        if (!answered) {
            return;
        }
        Path target = outputFile(outputDir, file);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(target, result.combinedOutput(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warning("Cannot save solver output to " + target + ": " + e.getMessage());
        }
    }

    /**
     * {@code dir/<script name without extension>.txt}.
     */
    public static Path outputFile(Path dir, Path script) {
        String name = script.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dir.resolve((dot > 0 ? name.substring(0, dot) : name) + ".txt");
    }

    static SolverCheckRecord toRecord(String file, String scriptText, OracleResult result) {
        if (result.status() == OracleStatus.TIMEOUT) {
            return new SolverCheckRecord(file, TIMEOUT_TOKEN, List.of(TIMEOUT_TOKEN), TIMEOUT_TIME);
        }
        String seconds = Double.toString(result.elapsed().toNanos() / 1e9);
        if (OracleOutputParser.hasError(result)) {
            boolean valid = COMMAND.matcher(scriptText).find();
            return new SolverCheckRecord(file, valid ? "True" : "False",
                    List.of(SolverCheckRecord.ERROR_TOKEN), seconds);
        }
        if (result.status() == OracleStatus.ERROR) {
            // transport failure, not an answer about the script
            return new SolverCheckRecord(file, SolverCheckRecord.ERROR_TOKEN,
                    List.of(SolverCheckRecord.ERROR_TOKEN), result.rawOutput());
        }
        return new SolverCheckRecord(file, "True", OracleOutputParser.checkTokens(result.rawOutput()), seconds);
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            logger.warning("Solver check pool shutdown interrupted");
        }
    }
}
