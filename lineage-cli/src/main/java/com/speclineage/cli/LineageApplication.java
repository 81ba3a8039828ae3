/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.cli;

import com.speclineage.api.AnalysisListener;
import com.speclineage.api.IOracleClient;
import com.speclineage.api.exceptions.LineageException;
import com.speclineage.api.exceptions.MalformedInputException;
import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.ChainStatusRow;
import com.speclineage.api.model.ConsecutiveResult;
import com.speclineage.api.model.EdgeTable;
import com.speclineage.api.model.LabelTally;
import com.speclineage.api.model.NonConsecutiveResult;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.artifact.ArtifactStore;
import com.speclineage.artifact.SolverCheckTable;
import com.speclineage.chains.ChainBuilder;
import com.speclineage.chains.ChainDistanceTable;
import com.speclineage.chains.ChainTable;
import com.speclineage.chains.EdgeTableLoader;
import com.speclineage.chains.status.ChainStatusAnalyzer;
import com.speclineage.check.ErrorCategorizer;
import com.speclineage.check.SolverCheckRunner;
import com.speclineage.classifier.ClassificationMemo;
import com.speclineage.classifier.PairClassifier;
import com.speclineage.classifier.analysis.ConsecutivePairAnalyzer;
import com.speclineage.classifier.analysis.NonConsecutivePairAnalyzer;
import com.speclineage.classifier.analysis.PairAnalysisContext;
import com.speclineage.classifier.analysis.policy.RedundancyPolicy;
import com.speclineage.infra.config.AnalysisConfig;
import com.speclineage.infra.lifecycle.CancellationToken;
import com.speclineage.infra.metrics.MetricsRegistry;
import com.speclineage.infra.telemetry.TracingService;
import com.speclineage.oracle.ProcessOracleClient;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Command-line entry point.
 *
 * <pre>
 * LineageApplication [--config file.properties] &lt;command&gt; [args]
 *
 *   build-chains &lt;dataset&gt;          reconstruct derivation chains from an edge table
 *   chain-distance                   edit distance between consecutive revisions
 *   check-scripts                    run every script through the solver once
 *   error-categories                 categorize the errors of saved solver outputs
 *   chain-status                     per-chain solver status and steps to fix
 *   compare-consecutive              classify adjacent pairs of every chain
 *   compare-non-consecutive [label]  count long-range pairs, all labels by default
 *   all &lt;dataset&gt;                   everything above, in order
 * </pre>
 *
 * Settings come from {@code lineage.properties}, the optional file,
 * {@code LINEAGE_*} environment variables and {@code -Dlineage.*} properties.
 */
public final class LineageApplication {

    private static final Logger logger = Logger.getLogger(LineageApplication.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static final String CHAIN_TABLE = "fmp_edit_paths_chain.csv";
    public static final String CHAIN_LIST = "fmp_edit_paths_chain_list.csv";
    public static final String SOLVER_RESULTS = "fmp-solver-results.csv";
    public static final String STATUS_TABLE = "fmp_edit_paths_status.csv";
    public static final String STEPS_TABLE = "fmp_steps_to_fix.csv";

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage: LineageApplication [--config file.properties] <command> [args]",
            "  build-chains <dataset>",
            "  chain-distance",
            "  check-scripts",
            "  error-categories",
            "  chain-status",
            "  compare-consecutive",
            "  compare-non-consecutive [equivalent|incomparable|s1_refines_s2|s2_refines_s1]",
            "  all <dataset>");

    private final AnalysisConfig config;
    private final CancellationToken cancellation;
    private final TracingService tracing;
    private final MetricsRegistry metrics;
    private final Supplier<IOracleClient> oracleFactory;
    private final AnalysisListener listener = new ProgressLogger();

    private IOracleClient oracle;
    private ClassificationMemo memo;

    public LineageApplication(AnalysisConfig config, CancellationToken cancellation, TracingService tracing,
                              MetricsRegistry metrics, Supplier<IOracleClient> oracleFactory) {
        this.config = config;
        this.cancellation = cancellation;
        this.tracing = tracing;
        this.metrics = metrics;
        this.oracleFactory = oracleFactory;
    }

    public static void main(String[] args) {
        configureLogging();
        String[] commandArgs = args;
        AnalysisConfig config;
        try {
            if (args.length >= 2 && args[0].equals("--config")) {
                config = AnalysisConfig.load(Paths.get(args[1]));
                commandArgs = Arrays.copyOfRange(args, 2, args.length);
            } else {
                config = AnalysisConfig.loadDefault();
            }
        } catch (IllegalArgumentException e) {
            logger.severe("Invalid configuration: " + e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }

        CancellationToken cancellation = CancellationToken.create();
        LineageApplication app = new LineageApplication(config, cancellation, TracingService.getInstance(),
                MetricsRegistry.getInstance(), () -> ProcessOracleClient.fromConfig(config, cancellation));
        Thread hook = new Thread(() -> {
            cancellation.cancel("shutdown requested");
            app.close();
        }, "lineage-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        int exitCode = app.run(commandArgs);
        Runtime.getRuntime().removeShutdownHook(hook);
        app.close();
        System.exit(exitCode);
    }

    /**
     * Runs one command.
     *
     * @return process exit code
     */
    public int run(String... args) {
        if (args.length == 0 || !isValid(args)) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        String command = args[0];
        logger.info(String.format("Running %s with %s", command, config));

        Span span = tracing.getTracer().spanBuilder("lineage:" + command).startSpan();
        try (Scope scope = span.makeCurrent()) {
            switch (command) {
                case "build-chains" -> buildChains(Paths.get(args[1]));
                case "chain-distance" -> chainDistance();
                case "check-scripts" -> checkScripts();
                case "error-categories" -> errorCategories();
                case "chain-status" -> chainStatus();
                case "compare-consecutive" -> compareConsecutive();
                case "compare-non-consecutive" ->
                        compareNonConsecutive(args.length > 1 ? RelationLabel.fromWireName(args[1]) : null);
                case "all" -> runAll(Paths.get(args[1]));
                default -> throw new IllegalStateException("Unhandled command " + command);
            }
            if (cancellation.isCancelled()) {
                logger.warning(command + " cancelled: " + cancellation.reason());
                return EXIT_FAILURE;
            }
            return EXIT_OK;
        } catch (MalformedInputException e) {
            span.recordException(e);
            logger.severe(e.getMessage());
            return EXIT_FAILURE;
        } catch (LineageException e) {
            span.recordException(e);
            logger.log(Level.SEVERE, command + " failed: " + e.getMessage(), e);
            return EXIT_FAILURE;
        } finally {
            span.end();
        }
    }

    private static boolean isValid(String[] args) {
        switch (args[0]) {
            case "build-chains":
            case "all":
                return args.length == 2;
            case "chain-distance":
            case "check-scripts":
            case "error-categories":
            case "chain-status":
            case "compare-consecutive":
                return args.length == 1;
            case "compare-non-consecutive":
                if (args.length == 1) {
                    return true;
                }
                try {
                    return args.length == 2 && RelationLabel.fromWireName(args[1]).isDefinite();
                } catch (IllegalArgumentException e) {
                    logger.warning(e.getMessage());
                    return false;
                }
            default:
                return false;
        }
    }

    ChainSet buildChains(Path dataset) {
        EdgeTable edges = new EdgeTableLoader().load(dataset);
        ChainBuilder builder = new ChainBuilder(artifacts());
        builder.setTracer(tracing.getTracer());
        ChainSet chains = builder.buildChains(edges);

        ChainTable.write(config.resultFile(CHAIN_TABLE), chains);
        ChainTable.writeList(config.resultFile(CHAIN_LIST), chains);
        logger.info(chains.overview().format());
        return chains;
    }

    void chainDistance() {
        ChainSet chains = ChainTable.readList(config.resultFile(CHAIN_LIST));
        new ChainDistanceTable(artifacts()).write(chains, config.resultFile(ChainDistanceTable.OUTPUT_FILE));
    }

    void errorCategories() {
        ArtifactStore scripts = new ArtifactStore(config.getCodeDir(), config.getArtifactExtension());
        new ErrorCategorizer(scripts).run(config.getOutputDir(), config.getResultsDir());
    }

    void checkScripts() {
        SolverCheckRunner runner = new SolverCheckRunner(oracle(), config, cancellation);
        runner.setTracer(tracing.getTracer());
        ArtifactStore scripts = new ArtifactStore(config.getCodeDir(), config.getArtifactExtension());
        runner.run(scripts, config.resultFile(SOLVER_RESULTS));
    }

    void chainStatus() {
        ChainSet chains = ChainTable.readList(config.resultFile(CHAIN_LIST));
        SolverCheckTable checks = SolverCheckTable.load(config.resultFile(SOLVER_RESULTS));
        ChainStatusAnalyzer analyzer = new ChainStatusAnalyzer(checks, artifacts()::fileNameOf);
        List<ChainStatusRow> rows = analyzer.analyze(chains);

        ChainStatusAnalyzer.writeStatusTable(config.resultFile(STATUS_TABLE), rows);
        ChainStatusAnalyzer.writeStepsTable(config.resultFile(STEPS_TABLE), rows);
        logger.info(ChainStatusAnalyzer.overview(rows).format());
    }

    void compareConsecutive() {
        ChainSet chains = ChainTable.readList(config.resultFile(CHAIN_LIST));
        ConsecutivePairAnalyzer analyzer = new ConsecutivePairAnalyzer(
                context(), config.getCheckpointInterval(), config.isResume(), cancellation);
        analyzer.setTracer(tracing.getTracer());
        List<ConsecutiveResult> results = analyzer.run(chains, config.resultFile(ConsecutivePairAnalyzer.OUTPUT_FILE));

        if (config.isResume()) {
            // the table also holds chains finished by earlier runs
            LabelTally tally = ConsecutivePairAnalyzer.tally(config.resultFile(ConsecutivePairAnalyzer.OUTPUT_FILE));
            logger.info("Consecutive pairs, all runs:" + System.lineSeparator() + tally.format());
        } else {
            logger.info("Consecutive pairs:" + System.lineSeparator() + LabelTally.of(results).format());
        }
    }

    void compareNonConsecutive(RelationLabel target) {
        ChainSet chains = ChainTable.readList(config.resultFile(CHAIN_LIST));
        NonConsecutivePairAnalyzer analyzer = new NonConsecutivePairAnalyzer(context(),
                RedundancyPolicy.of(config.getPruningPolicy()), config.getCheckpointInterval(),
                config.isResume(), cancellation, metrics);
        analyzer.setTracer(tracing.getTracer());

        if (target != null) {
            List<NonConsecutiveResult> results = analyzer.run(chains, target,
                    config.resultFile(NonConsecutivePairAnalyzer.outputFileName(target)));
            logCounts(target, results);
            return;
        }
        Map<RelationLabel, List<NonConsecutiveResult>> all = analyzer.runAllLabels(chains, config.getResultsDir());
        all.forEach(LineageApplication::logCounts);
    }

    private void runAll(Path dataset) {
        buildChains(dataset);
        List<Runnable> steps = List.of(this::chainDistance, this::checkScripts, this::errorCategories,
                this::chainStatus,
                this::compareConsecutive, () -> compareNonConsecutive(null));
        for (Runnable step : steps) {
            if (cancellation.isCancelled()) {
                return;
            }
            step.run();
        }
    }

    private static void logCounts(RelationLabel target, List<NonConsecutiveResult> results) {
        int pairs = results.stream().mapToInt(NonConsecutiveResult::count).sum();
        long chains = results.stream().filter(r -> r.count() > 0).count();
        logger.info(String.format("Non-consecutive %s pairs: %d in %d of %d chains",
                target.wireName(), pairs, chains, results.size()));
    }

    private ArtifactStore artifacts() {
        return new ArtifactStore(config.getArtifactDir(), config.getArtifactExtension());
    }

    private synchronized IOracleClient oracle() {
        if (oracle == null) {
            oracle = oracleFactory.get();
        }
        return oracle;
    }

    private PairAnalysisContext context() {
        Path checksFile = config.resultFile(SOLVER_RESULTS);
        SolverCheckTable checks;
        if (Files.isRegularFile(checksFile)) {
            checks = SolverCheckTable.load(checksFile);
        } else {
            logger.warning("No solver check results at " + checksFile + "; no script is excluded");
            checks = SolverCheckTable.empty();
        }
        synchronized (this) {
            if (memo == null) {
                memo = new ClassificationMemo(new PairClassifier(artifacts(), oracle()),
                        config.getMemoMaxSize(), metrics);
            }
        }
        return new PairAnalysisContext(artifacts(), checks, memo, listener);
    }

    /**
     * Stops solver processes and flushes spans. Safe to call more than once.
     */
    public synchronized void close() {
        if (memo != null) {
            logger.info(String.format("Classification memo: %d pairs, %s", memo.size(), memo.stats()));
        }
        if (oracle instanceof ProcessOracleClient client) {
            client.close();
        }
        oracle = null;
        memo = null;
        tracing.shutdown();
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = LineageApplication.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
