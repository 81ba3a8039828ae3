package com.speclineage.cli;

import com.speclineage.api.IOracleClient;
import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.OracleResult;
import com.speclineage.api.model.OracleStatus;
import com.speclineage.chains.ChainDistanceTable;
import com.speclineage.chains.ChainTable;
import com.speclineage.check.ErrorCategorizer;
import com.speclineage.classifier.analysis.ConsecutivePairAnalyzer;
import com.speclineage.classifier.analysis.NonConsecutivePairAnalyzer;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.infra.config.AnalysisConfig;
import com.speclineage.infra.io.CsvTable;
import com.speclineage.infra.io.CsvTables;
import com.speclineage.infra.lifecycle.CancellationToken;
import com.speclineage.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.speclineage.infra.telemetry.TracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LineageApplicationTest {

    @Mock
    private IOracleClient oracle;

    @TempDir
    Path dir;

    private AnalysisConfig config;
    private LineageApplication app;

    @BeforeEach
    void setUp() throws Exception {
        Path spec = Files.createDirectories(dir.resolve("data/spec"));
        for (String id : new String[] {"1", "2", "3"}) {
            Files.writeString(spec.resolve(id + ".smt2"), "(declare-const x Int)\n(assert (> x 0))\n(check-sat)\n");
        }
        config = AnalysisConfig.builder()
                .artifactDir(spec)
                .codeDir(dir.resolve("data/code"))
                .outputDir(dir.resolve("data/output"))
                .resultsDir(dir.resolve("results"))
                .build();
        app = new LineageApplication(config, CancellationToken.create(), TracingService.noop(),
                new InMemoryMetricsRegistry(), () -> oracle);
    }

    @AfterEach
    void tearDown() {
        app.close();
    }

    private Path dataset() throws Exception {
        Path file = dir.resolve("fmp.json");
        Files.writeString(file, """
                {"id": 1.0, "parent": NaN}
                {"id": 2.0, "parent": 1.0}
                {"id": 3.0, "parent": 2.0}
                """);
        return file;
    }

    @Test
    @DisplayName("build-chains writes both chain tables")
    void shouldBuildChains() throws Exception {
        int exit = app.run("build-chains", dataset().toString());

        assertThat(exit).isEqualTo(LineageApplication.EXIT_OK);
        assertThat(config.resultFile(LineageApplication.CHAIN_TABLE)).exists();
        ChainSet chains = ChainTable.readList(config.resultFile(LineageApplication.CHAIN_LIST));
        assertThat(chains.size()).isEqualTo(1);
        assertThat(chains.chains().get(0).format()).isEqualTo("3 -> 2 -> 1");
        verifyNoInteractions(oracle);
    }

    @Test
    @DisplayName("Malformed input exits with status 1")
    void malformedInput() {
        int exit = app.run("build-chains", dir.resolve("missing.json").toString());

        assertThat(exit).isEqualTo(LineageApplication.EXIT_FAILURE);
    }

    @Test
    @DisplayName("Unknown commands and missing arguments print usage")
    void usage() {
        assertThat(app.run()).isEqualTo(LineageApplication.EXIT_USAGE);
        assertThat(app.run("frobnicate")).isEqualTo(LineageApplication.EXIT_USAGE);
        assertThat(app.run("build-chains")).isEqualTo(LineageApplication.EXIT_USAGE);
        assertThat(app.run("compare-non-consecutive", "unknown")).isEqualTo(LineageApplication.EXIT_USAGE);
        assertThat(app.run("compare-non-consecutive", "nonsense")).isEqualTo(LineageApplication.EXIT_USAGE);
    }

    @Test
    @DisplayName("compare-consecutive labels adjacent pairs through the solver")
    void shouldCompareConsecutive() throws Exception {
        when(oracle.query(anyString())).thenReturn(new OracleResult(OracleStatus.UNSAT, "unsat", Duration.ofMillis(3)));
        app.run("build-chains", dataset().toString());

        int exit = app.run("compare-consecutive");

        assertThat(exit).isEqualTo(LineageApplication.EXIT_OK);
        CsvTable table = CsvTables.read(config.resultFile(ConsecutivePairAnalyzer.OUTPUT_FILE));
        assertThat(table.rows()).hasSize(1);
        assertThat(table.rows().get(0).get("id")).isEqualTo("3");
        assertThat(table.rows().get(0).get("semantic_compare")).isEqualTo("['equivalent', 'equivalent']");
    }

    @Test
    @DisplayName("compare-non-consecutive with one label writes that label's table")
    void shouldCompareOneLabel() throws Exception {
        when(oracle.query(anyString())).thenReturn(new OracleResult(OracleStatus.SAT, "sat", Duration.ofMillis(3)));
        app.run("build-chains", dataset().toString());

        int exit = app.run("compare-non-consecutive", "equivalent");

        assertThat(exit).isEqualTo(LineageApplication.EXIT_OK);
        CsvTable table = CsvTables.read(config.resultFile(
                NonConsecutivePairAnalyzer.outputFileName(RelationLabel.EQUIVALENT)));
        assertThat(table.rows()).hasSize(1);
        assertThat(table.rows().get(0).get("count")).isEqualTo("0");
        assertThat(config.resultFile(NonConsecutivePairAnalyzer.outputFileName(RelationLabel.INCOMPARABLE)))
                .doesNotExist();
    }

    @Test
    @DisplayName("chain-status reads the solver results and writes both status tables")
    void shouldWriteChainStatus() throws Exception {
        app.run("build-chains", dataset().toString());
        Files.writeString(config.resultFile(LineageApplication.SOLVER_RESULTS), """
                file,valid_spec,check,time_taken
                data/code/1.smt2,False,ERROR,0.01
                data/code/2.smt2,True,['unsat'],0.02
                data/code/3.smt2,True,['sat'],0.03
                """);

        int exit = app.run("chain-status");

        assertThat(exit).isEqualTo(LineageApplication.EXIT_OK);
        assertThat(CsvTables.read(config.resultFile(LineageApplication.STATUS_TABLE)).rows()).hasSize(1);
        assertThat(config.resultFile(LineageApplication.STEPS_TABLE)).exists();
        verifyNoInteractions(oracle);
    }

    @Test
    @DisplayName("chain-distance writes edit distances for chains of three or more")
    void shouldWriteChainDistances() throws Exception {
        app.run("build-chains", dataset().toString());

        int exit = app.run("chain-distance");

        assertThat(exit).isEqualTo(LineageApplication.EXIT_OK);
        CsvTable table = CsvTables.read(config.resultFile(ChainDistanceTable.OUTPUT_FILE));
        assertThat(table.rows()).hasSize(1);
        assertThat(table.rows().get(0).get("distances")).isEqualTo("[0, 0]");
        verifyNoInteractions(oracle);
    }

    @Test
    @DisplayName("check-scripts keeps solver output that error-categories then sorts")
    void shouldCategorizeCheckErrors() throws Exception {
        Path code = Files.createDirectories(dir.resolve("data/code"));
        Files.writeString(code.resolve("7.smt2"), "(assert (> y 0))\n(check-sat)\n");
        when(oracle.query(anyString())).thenReturn(new OracleResult(OracleStatus.ERROR,
                "(error \"line 1 column 12: unknown constant y\")\nsat\n", Duration.ofMillis(3)));

        assertThat(app.run("check-scripts")).isEqualTo(LineageApplication.EXIT_OK);
        assertThat(dir.resolve("data/output/7.txt")).exists();

        assertThat(app.run("error-categories")).isEqualTo(LineageApplication.EXIT_OK);
        CsvTable categorized = CsvTables.read(config.resultFile(ErrorCategorizer.CATEGORIZED_FILE));
        assertThat(categorized.rows()).hasSize(1);
        assertThat(categorized.rows().get(0).get("category")).isEqualTo("unknown constant *");
        assertThat(categorized.rows().get(0).get("context")).isEqualTo("assert");
    }
}
