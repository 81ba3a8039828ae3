package com.speclineage.classifier.analysis;

import com.speclineage.api.AnalysisListener;
import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.ConsecutiveResult;
import com.speclineage.api.model.DerivationChain;
import com.speclineage.api.model.LabelTally;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.api.model.SolverCheckRecord;
import com.speclineage.artifact.ArtifactStore;
import com.speclineage.artifact.SolverCheckTable;
import com.speclineage.infra.io.CsvTable;
import com.speclineage.infra.io.CsvTables;
import com.speclineage.infra.lifecycle.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsecutivePairAnalyzerTest {

    @TempDir
    Path dir;

    private ArtifactStore store;
    private SolverCheckTable checks;
    private RecordingClassifier classifier;

    @BeforeEach
    void setUp() throws Exception {
        Path spec = Files.createDirectories(dir.resolve("spec"));
        store = new ArtifactStore(spec, "smt2");
        for (String id : List.of("1", "2", "3", "4", "5")) {
            Files.writeString(spec.resolve(id + ".smt2"), "(assert true)");
        }
        checks = SolverCheckTable.of(List.of(
                new SolverCheckRecord("data/code/5.smt2", "False", List.of("ERROR"), "0.2")));
        classifier = new RecordingClassifier(RelationLabel.EQUIVALENT)
                .with("2", "3", RelationLabel.S2_REFINES_S1);
    }

    private ConsecutivePairAnalyzer analyzer(boolean resume) {
        PairAnalysisContext context = new PairAnalysisContext(store, checks, classifier, null);
        return new ConsecutivePairAnalyzer(context, 50, resume, CancellationToken.create());
    }

    @Test
    @DisplayName("Should label adjacent pairs oldest first")
    void shouldCompareAdjacentPairs() {
        ConsecutiveResult result = analyzer(false).compare(DerivationChain.of("4", "3", "2", "1"));

        assertThat(result.id().value()).isEqualTo("4");
        assertThat(result.labels()).containsExactly(
                RelationLabel.EQUIVALENT, RelationLabel.S2_REFINES_S1, RelationLabel.EQUIVALENT);
        assertThat(classifier.calls).containsExactly("1,2", "2,3", "3,4");
    }

    @Test
    @DisplayName("Errored scripts give ERROR and missing scripts drop the pair")
    void shouldHandleErroredAndMissing() {
        ConsecutiveResult errored = analyzer(false).compare(DerivationChain.of("5", "4"));
        ConsecutiveResult missing = analyzer(false).compare(DerivationChain.of("9", "2", "1"));

        assertThat(errored.labels()).containsExactly(RelationLabel.ERROR);
        assertThat(missing.labels()).containsExactly(RelationLabel.EQUIVALENT);
        assertThat(classifier.calls).containsExactly("1,2");
    }

    @Test
    @DisplayName("A single-script chain has an empty row")
    void singleScriptChain() {
        assertThat(analyzer(false).compare(DerivationChain.of("1")).labels()).isEmpty();
    }

    @Test
    @DisplayName("Should write the comparison table and tally it back")
    void shouldWriteAndTally() {
        Path output = dir.resolve(ConsecutivePairAnalyzer.OUTPUT_FILE);
        ChainSet chains = new ChainSet(List.of(
                DerivationChain.of("4", "3", "2", "1"),
                DerivationChain.of("5", "4"),
                DerivationChain.of("1")));

        List<ConsecutiveResult> results = analyzer(false).run(chains, output);

        assertThat(results).hasSize(3);
        CsvTable table = CsvTables.read(output);
        assertThat(table.rows()).extracting(row -> row.get("semantic_compare")).containsExactly(
                "['equivalent', 's2_refines_s1', 'equivalent']", "['ERROR']", "[]");

        LabelTally tally = ConsecutivePairAnalyzer.tally(output);
        assertThat(tally.total()).isEqualTo(4);
        assertThat(tally.count(RelationLabel.EQUIVALENT)).isEqualTo(2);
        assertThat(tally.count(RelationLabel.ERROR)).isEqualTo(1);
    }

    @Test
    @DisplayName("Resume skips chains already in the table")
    void shouldResume() throws Exception {
        Path output = dir.resolve(ConsecutivePairAnalyzer.OUTPUT_FILE);
        Files.writeString(output, "id,semantic_compare\n4,\"['unknown']\"\n");
        ChainSet chains = new ChainSet(List.of(DerivationChain.of("4", "3", "2", "1"), DerivationChain.of("2", "1")));

        List<ConsecutiveResult> results = analyzer(true).run(chains, output);

        assertThat(results).extracting(r -> r.id().value()).containsExactly("2");
        assertThat(classifier.calls).containsExactly("1,2");
        assertThat(CsvTables.read(output).rows()).extracting(row -> row.get("semantic_compare"))
                .containsExactly("['unknown']", "['equivalent']");
    }

    @Test
    @DisplayName("Cancellation inside a chain persists no partial row and resume finishes it")
    void cancellationMidChainLeavesNoRow() {
        Path output = dir.resolve(ConsecutivePairAnalyzer.OUTPUT_FILE);
        ChainSet chains = new ChainSet(List.of(DerivationChain.of("4", "3", "2", "1")));
        CancellationToken token = CancellationToken.create();
        AnalysisListener cancelAfterFirstPair = new AnalysisListener() {
            @Override
            public void onPairClassified(ScriptId first, ScriptId second, RelationLabel label) {
                token.cancel("shutdown");
            }
        };
        PairAnalysisContext context = new PairAnalysisContext(store, checks, classifier, cancelAfterFirstPair);

        List<ConsecutiveResult> results = new ConsecutivePairAnalyzer(context, 1, false, token).run(chains, output);

        assertThat(results).isEmpty();
        assertThat(classifier.calls).containsExactly("1,2");
        assertThat(CsvTables.read(output).rows()).isEmpty();

        List<ConsecutiveResult> resumed = analyzer(true).run(chains, output);

        assertThat(resumed).hasSize(1);
        assertThat(CsvTables.read(output).rows()).extracting(row -> row.get("semantic_compare"))
                .containsExactly("['equivalent', 's2_refines_s1', 'equivalent']");
    }

    @Test
    @DisplayName("compare answers null once the run is cancelled during a classification")
    void compareReturnsNullWhenCancelled() {
        CancellationToken token = CancellationToken.create();
        AnalysisListener cancelling = new AnalysisListener() {
            @Override
            public void onPairClassified(ScriptId first, ScriptId second, RelationLabel label) {
                token.cancel("stop");
            }
        };
        PairAnalysisContext context = new PairAnalysisContext(store, checks, classifier, cancelling);

        assertThat(new ConsecutivePairAnalyzer(context, 50, false, token).compare(DerivationChain.of("2", "1")))
                .isNull();
    }
}
