package com.speclineage.infra.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisConfigTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void defaults() {
        AnalysisConfig config = AnalysisConfig.builder().build();

        assertThat(config.getArtifactDir()).isEqualTo(Path.of("data", "spec"));
        assertThat(config.getArtifactExtension()).isEqualTo("smt2");
        assertThat(config.getOutputDir()).isEqualTo(Path.of("data", "output"));
        assertThat(config.getSolverCommand()).containsExactly("z3", "-in");
        assertThat(config.getSolverTimeout()).isEqualTo(Duration.ofSeconds(600));
        assertThat(config.getMaxSolverProcesses()).isEqualTo(4);
        assertThat(config.getCheckBatchSize()).isEqualTo(100);
        assertThat(config.getCheckpointInterval()).isEqualTo(50);
        assertThat(config.isResume()).isFalse();
        assertThat(config.getPruningPolicy()).isEqualTo(AnalysisConfig.PruningPolicy.NEAREST_WITNESS);
    }

    @Test
    @DisplayName("Properties are applied and environment wins over them")
    void environmentOverridesProperties() {
        Properties props = new Properties();
        props.setProperty("lineage.solver.timeout.seconds", "30");
        props.setProperty("lineage.solver.command", "cvc5 --lang smt2");
        props.setProperty("lineage.resume", "true");

        AnalysisConfig config = AnalysisConfig.builder()
                .applyProperties(props)
                .applyEnvironment(Map.of(
                        "LINEAGE_SOLVER_TIMEOUT_SECONDS", "5",
                        "LINEAGE_PRUNING_POLICY", "none",
                        "LINEAGE_OUTPUT_DIR", "out/solver"))
                .build();

        assertThat(config.getSolverTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getSolverCommand()).containsExactly("cvc5", "--lang", "smt2");
        assertThat(config.isResume()).isTrue();
        assertThat(config.getPruningPolicy()).isEqualTo(AnalysisConfig.PruningPolicy.NONE);
        assertThat(config.getOutputDir()).isEqualTo(Path.of("out/solver"));
    }

    @Test
    @DisplayName("Invalid values are ignored and keep the previous value")
    void invalidValuesIgnored() {
        AnalysisConfig config = AnalysisConfig.builder()
                .applyEnvironment(Map.of(
                        "LINEAGE_CHECK_WORKERS", "many",
                        "LINEAGE_PRUNING_POLICY", "sometimes"))
                .build();

        assertThat(config.getCheckWorkers()).isEqualTo(4);
        assertThat(config.getPruningPolicy()).isEqualTo(AnalysisConfig.PruningPolicy.NEAREST_WITNESS);
    }

    @Test
    @DisplayName("Properties file on disk is layered over the classpath defaults")
    void loadsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("run.properties");
        Files.writeString(file, "lineage.check.batch.size=7\nlineage.artifact.extension=.smt\n");

        AnalysisConfig config = AnalysisConfig.load(file);

        assertThat(config.getCheckBatchSize()).isEqualTo(7);
        assertThat(config.getArtifactExtension()).isEqualTo("smt");
    }

    @Test
    @DisplayName("Missing properties file is rejected")
    void missingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> AnalysisConfig.load(dir.resolve("absent.properties")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Build validates limits")
    void validates() {
        assertThatThrownBy(() -> AnalysisConfig.builder().solverTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AnalysisConfig.builder().solverCommand(List.of()).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AnalysisConfig.builder().checkpointInterval(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilderCopiesEverything() {
        AnalysisConfig original = AnalysisConfig.builder().memoMaxSize(12).resume(true).build();
        AnalysisConfig copy = original.toBuilder().build();

        assertThat(copy.toString()).isEqualTo(original.toString());
    }
}
