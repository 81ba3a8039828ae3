/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Unified configuration of an analysis run.
 *
 * <p>Values are layered, later layers winning:
 * <ol>
 *   <li>built-in defaults</li>
 *   <li>{@code lineage.properties} on the classpath</li>
 *   <li>an optional properties file given on the command line</li>
 *   <li>environment variables {@code LINEAGE_<KEY>}</li>
 *   <li>system properties {@code -Dlineage.<key>}</li>
 * </ol>
 *
 * <p>Each property key maps to an environment variable by upper-casing it and
 * replacing dots with underscores: {@code lineage.solver.timeout.seconds}
 * becomes {@code LINEAGE_SOLVER_TIMEOUT_SECONDS}.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * AnalysisConfig config = AnalysisConfig.builder()
 *     .artifactDir(Path.of("data/spec"))
 *     .solverTimeout(Duration.ofMinutes(2))
 *     .build();
 * }</pre>
 */
public final class AnalysisConfig {

    private static final Logger logger = Logger.getLogger(AnalysisConfig.class.getName());

    public static final String DEFAULT_RESOURCE = "lineage.properties";

    // ========================================================================
    // PROPERTY KEYS
    // ========================================================================

    public static final String KEY_ARTIFACT_DIR = "lineage.artifact.dir";
    public static final String KEY_CODE_DIR = "lineage.code.dir";
    public static final String KEY_OUTPUT_DIR = "lineage.output.dir";
    public static final String KEY_ARTIFACT_EXTENSION = "lineage.artifact.extension";
    public static final String KEY_RESULTS_DIR = "lineage.results.dir";
    public static final String KEY_SOLVER_COMMAND = "lineage.solver.command";
    public static final String KEY_SOLVER_TIMEOUT_SECONDS = "lineage.solver.timeout.seconds";
    public static final String KEY_SOLVER_MAX_PROCESSES = "lineage.solver.max.processes";
    public static final String KEY_CHECK_WORKERS = "lineage.check.workers";
    public static final String KEY_CHECK_BATCH_SIZE = "lineage.check.batch.size";
    public static final String KEY_CHECKPOINT_INTERVAL = "lineage.checkpoint.interval";
    public static final String KEY_MEMO_MAX_SIZE = "lineage.memo.max.size";
    public static final String KEY_RESUME = "lineage.resume";
    public static final String KEY_PRUNING_POLICY = "lineage.pruning.policy";

    private static final List<String> ALL_KEYS = List.of(
            KEY_ARTIFACT_DIR, KEY_CODE_DIR, KEY_OUTPUT_DIR, KEY_ARTIFACT_EXTENSION, KEY_RESULTS_DIR,
            KEY_SOLVER_COMMAND, KEY_SOLVER_TIMEOUT_SECONDS, KEY_SOLVER_MAX_PROCESSES,
            KEY_CHECK_WORKERS, KEY_CHECK_BATCH_SIZE, KEY_CHECKPOINT_INTERVAL,
            KEY_MEMO_MAX_SIZE, KEY_RESUME, KEY_PRUNING_POLICY);

    /**
     * How long-range pairs are pruned before being sent to the solver.
     */
    public enum PruningPolicy {
        /** Skip a pair when an adjacent pair inside its span already carries the target label. */
        NEAREST_WITNESS,

        /** Classify every candidate pair directly. */
        NONE
    }

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final Path artifactDir;
    private final Path codeDir;
    private final Path outputDir;
    private final String artifactExtension;
    private final Path resultsDir;
    private final List<String> solverCommand;
    private final Duration solverTimeout;
    private final int maxSolverProcesses;
    private final int checkWorkers;
    private final int checkBatchSize;
    private final int checkpointInterval;
    private final long memoMaxSize;
    private final boolean resume;
    private final PruningPolicy pruningPolicy;

    private AnalysisConfig(Builder builder) {
        this.artifactDir = builder.artifactDir;
        this.codeDir = builder.codeDir;
        this.outputDir = builder.outputDir;
        this.artifactExtension = builder.artifactExtension;
        this.resultsDir = builder.resultsDir;
        this.solverCommand = List.copyOf(builder.solverCommand);
        this.solverTimeout = builder.solverTimeout;
        this.maxSolverProcesses = builder.maxSolverProcesses;
        this.checkWorkers = builder.checkWorkers;
        this.checkBatchSize = builder.checkBatchSize;
        this.checkpointInterval = builder.checkpointInterval;
        this.memoMaxSize = builder.memoMaxSize;
        this.resume = builder.resume;
        this.pruningPolicy = builder.pruningPolicy;
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults, then the classpath {@code lineage.properties}, then environment
     * variables and system properties.
     */
    public static AnalysisConfig loadDefault() {
        return load(null);
    }

    /**
     * Like {@link #loadDefault()} with an extra properties file layered on top
     * of the classpath resource.
     *
     * @param propertiesFile optional file, may be {@code null}
     * @throws IllegalArgumentException if the file is given but cannot be read
     */
    public static AnalysisConfig load(Path propertiesFile) {
        Builder builder = builder();
        builder.applyProperties(loadClasspathResource(DEFAULT_RESOURCE));
        if (propertiesFile != null) {
            builder.applyProperties(loadFile(propertiesFile));
        }
        builder.applyEnvironment(System::getenv);
        builder.applyProperties(System.getProperties());
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.artifactDir = artifactDir;
        builder.codeDir = codeDir;
        builder.outputDir = outputDir;
        builder.artifactExtension = artifactExtension;
        builder.resultsDir = resultsDir;
        builder.solverCommand = new ArrayList<>(solverCommand);
        builder.solverTimeout = solverTimeout;
        builder.maxSolverProcesses = maxSolverProcesses;
        builder.checkWorkers = checkWorkers;
        builder.checkBatchSize = checkBatchSize;
        builder.checkpointInterval = checkpointInterval;
        builder.memoMaxSize = memoMaxSize;
        builder.resume = resume;
        builder.pruningPolicy = pruningPolicy;
        return builder;
    }

    private static Properties loadClasspathResource(String resource) {
        Properties props = new Properties();
        try (InputStream is = AnalysisConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
                logger.fine("Loaded " + props.size() + " properties from classpath: " + resource);
            }
        } catch (IOException e) {
            logger.warning("Could not read classpath resource " + resource + ": " + e.getMessage());
        }
        return props;
    }

    private static Properties loadFile(Path file) {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
            logger.info("Loaded " + props.size() + " properties from file: " + file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration file " + file, e);
        }
        return props;
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public Path getArtifactDir() {
        return artifactDir;
    }

    public Path getCodeDir() {
        return codeDir;
    }

    /**
     * Where the solver check run keeps what the solver printed for each script.
     */
    public Path getOutputDir() {
        return outputDir;
    }

    public String getArtifactExtension() {
        return artifactExtension;
    }

    public Path getResultsDir() {
        return resultsDir;
    }

    public List<String> getSolverCommand() {
        return solverCommand;
    }

    public Duration getSolverTimeout() {
        return solverTimeout;
    }

    public int getMaxSolverProcesses() {
        return maxSolverProcesses;
    }

    public int getCheckWorkers() {
        return checkWorkers;
    }

    public int getCheckBatchSize() {
        return checkBatchSize;
    }

    public int getCheckpointInterval() {
        return checkpointInterval;
    }

    public long getMemoMaxSize() {
        return memoMaxSize;
    }

    public boolean isResume() {
        return resume;
    }

    public PruningPolicy getPruningPolicy() {
        return pruningPolicy;
    }

    public Path resultFile(String name) {
        return resultsDir.resolve(name);
    }

    @Override
    public String toString() {
        return String.format(
                "AnalysisConfig{artifacts=%s (*.%s), code=%s, output=%s, results=%s, solver=%s, timeout=%ds, " +
                "processes=%d, workers=%d, batch=%d, checkpoint=%d, memo=%d, resume=%s, pruning=%s}",
                artifactDir, artifactExtension, codeDir, outputDir, resultsDir, String.join(" ", solverCommand),
                solverTimeout.toSeconds(), maxSolverProcesses, checkWorkers, checkBatchSize,
                checkpointInterval, memoMaxSize, resume, pruningPolicy);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private Path artifactDir = Path.of("data", "spec");
        private Path codeDir = Path.of("data", "code");
        private Path outputDir = Path.of("data", "output");
        private String artifactExtension = "smt2";
        private Path resultsDir = Path.of("results");
        private List<String> solverCommand = new ArrayList<>(List.of("z3", "-in"));
        private Duration solverTimeout = Duration.ofSeconds(600);
        private int maxSolverProcesses = 4;
        private int checkWorkers = 4;
        private int checkBatchSize = 100;
        private int checkpointInterval = 50;
        private long memoMaxSize = 100_000;
        private boolean resume = false;
        private PruningPolicy pruningPolicy = PruningPolicy.NEAREST_WITNESS;

        private Builder() {
        }

        public Builder artifactDir(Path dir) {
            this.artifactDir = dir;
            return this;
        }

        public Builder codeDir(Path dir) {
            this.codeDir = dir;
            return this;
        }

        public Builder outputDir(Path dir) {
            this.outputDir = dir;
            return this;
        }

        public Builder artifactExtension(String extension) {
            this.artifactExtension = extension.startsWith(".") ? extension.substring(1) : extension;
            return this;
        }

        public Builder resultsDir(Path dir) {
            this.resultsDir = dir;
            return this;
        }

        public Builder solverCommand(List<String> command) {
            this.solverCommand = new ArrayList<>(command);
            return this;
        }

        public Builder solverCommand(String... command) {
            return solverCommand(Arrays.asList(command));
        }

        public Builder solverTimeout(Duration timeout) {
            this.solverTimeout = timeout;
            return this;
        }

        public Builder maxSolverProcesses(int processes) {
            this.maxSolverProcesses = processes;
            return this;
        }

        public Builder checkWorkers(int workers) {
            this.checkWorkers = workers;
            return this;
        }

        public Builder checkBatchSize(int size) {
            this.checkBatchSize = size;
            return this;
        }

        public Builder checkpointInterval(int interval) {
            this.checkpointInterval = interval;
            return this;
        }

        public Builder memoMaxSize(long size) {
            this.memoMaxSize = size;
            return this;
        }

        public Builder resume(boolean resume) {
            this.resume = resume;
            return this;
        }

        public Builder pruningPolicy(PruningPolicy policy) {
            this.pruningPolicy = policy;
            return this;
        }

        /**
         * Applies every {@code lineage.*} key present in {@code props}.
         */
        public Builder applyProperties(Properties props) {
            for (String key : ALL_KEYS) {
                String value = props.getProperty(key);
                if (value != null && !value.isBlank()) {
                    apply(key, value.trim());
                }
            }
            return this;
        }

        /**
         * Applies {@code LINEAGE_*} variables resolved through {@code env}.
         */
        public Builder applyEnvironment(Function<String, String> env) {
            for (String key : ALL_KEYS) {
                String value = env.apply(toEnvName(key));
                if (value != null && !value.isBlank()) {
                    logger.fine("Loaded env var: " + toEnvName(key) + "=" + value);
                    apply(key, value.trim());
                }
            }
            return this;
        }

        public Builder applyEnvironment(Map<String, String> env) {
            return applyEnvironment(env::get);
        }

        private void apply(String key, String value) {
            try {
                switch (key) {
                    case KEY_ARTIFACT_DIR -> artifactDir = Path.of(value);
                    case KEY_CODE_DIR -> codeDir = Path.of(value);
                    case KEY_OUTPUT_DIR -> outputDir = Path.of(value);
                    case KEY_ARTIFACT_EXTENSION -> artifactExtension(value);
                    case KEY_RESULTS_DIR -> resultsDir = Path.of(value);
                    case KEY_SOLVER_COMMAND -> solverCommand = new ArrayList<>(Arrays.asList(value.split("\\s+")));
                    case KEY_SOLVER_TIMEOUT_SECONDS -> solverTimeout = Duration.ofSeconds(Long.parseLong(value));
                    case KEY_SOLVER_MAX_PROCESSES -> maxSolverProcesses = Integer.parseInt(value);
                    case KEY_CHECK_WORKERS -> checkWorkers = Integer.parseInt(value);
                    case KEY_CHECK_BATCH_SIZE -> checkBatchSize = Integer.parseInt(value);
                    case KEY_CHECKPOINT_INTERVAL -> checkpointInterval = Integer.parseInt(value);
                    case KEY_MEMO_MAX_SIZE -> memoMaxSize = Long.parseLong(value);
                    case KEY_RESUME -> resume = parseBoolean(value);
                    case KEY_PRUNING_POLICY -> pruningPolicy = PruningPolicy.valueOf(value.toUpperCase(Locale.ROOT));
                    default -> throw new IllegalStateException("Unhandled key " + key);
                }
            } catch (IllegalArgumentException e) {
                logger.warning("Invalid value for " + key + ": " + value + ", keeping " + describe(key));
            }
        }

        private String describe(String key) {
            return Optional.ofNullable(snapshot().get(key)).orElse("default");
        }

        private Map<String, String> snapshot() {
            return Map.of(
                    KEY_SOLVER_TIMEOUT_SECONDS, Long.toString(solverTimeout.toSeconds()),
                    KEY_SOLVER_MAX_PROCESSES, Integer.toString(maxSolverProcesses),
                    KEY_CHECK_WORKERS, Integer.toString(checkWorkers),
                    KEY_CHECK_BATCH_SIZE, Integer.toString(checkBatchSize),
                    KEY_CHECKPOINT_INTERVAL, Integer.toString(checkpointInterval),
                    KEY_MEMO_MAX_SIZE, Long.toString(memoMaxSize),
                    KEY_PRUNING_POLICY, pruningPolicy.name());
        }

        private static boolean parseBoolean(String value) {
            String normalized = value.toLowerCase(Locale.ROOT);
            return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
        }

        static String toEnvName(String key) {
            return key.toUpperCase(Locale.ROOT).replace('.', '_');
        }

        public AnalysisConfig build() {
            if (solverCommand.isEmpty()) {
                throw new IllegalArgumentException("Solver command cannot be empty");
            }
            if (solverTimeout.isNegative() || solverTimeout.isZero()) {
                throw new IllegalArgumentException("Solver timeout must be positive, got: " + solverTimeout);
            }
            if (maxSolverProcesses < 1 || checkWorkers < 1) {
                throw new IllegalArgumentException("Process and worker limits must be at least 1");
            }
            if (checkBatchSize < 1 || checkpointInterval < 1) {
                throw new IllegalArgumentException("Batch size and checkpoint interval must be at least 1");
            }
            return new AnalysisConfig(this);
        }
    }
}
