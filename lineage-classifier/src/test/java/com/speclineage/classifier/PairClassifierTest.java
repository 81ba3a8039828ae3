package com.speclineage.classifier;

import com.speclineage.api.IOracleClient;
import com.speclineage.api.model.OracleResult;
import com.speclineage.api.model.OracleStatus;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.artifact.ArtifactStore;
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
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PairClassifierTest {

    @Mock
    private IOracleClient oracle;

    @TempDir
    Path dir;

    private ArtifactStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new ArtifactStore(dir, "smt2");
        Files.writeString(dir.resolve("a.smt2"), "(declare-const x Int)\n(assert (> x 0))\n(check-sat)\n");
        Files.writeString(dir.resolve("a2.smt2"), "; same as a\n(declare-const x Int)\n(assert (> x 0))\n");
        Files.writeString(dir.resolve("b.smt2"), "(declare-const x Int)\n(assert (> x 1))\n(check-sat)\n");
        Files.writeString(dir.resolve("broken.smt2"), "(assert (> x 0)\n");
    }

    private static OracleResult result(OracleStatus status) {
        return new OracleResult(status, status.name().toLowerCase(), Duration.ofMillis(5));
    }

    @Test
    @DisplayName("Decision table maps both query answers to a label")
    void decisionTable() {
        assertThat(PairClassifier.decide(OracleStatus.UNSAT, OracleStatus.UNSAT)).isEqualTo(RelationLabel.EQUIVALENT);
        assertThat(PairClassifier.decide(OracleStatus.SAT, OracleStatus.SAT)).isEqualTo(RelationLabel.INCOMPARABLE);
        assertThat(PairClassifier.decide(OracleStatus.UNSAT, OracleStatus.SAT)).isEqualTo(RelationLabel.S1_REFINES_S2);
        assertThat(PairClassifier.decide(OracleStatus.SAT, OracleStatus.UNSAT)).isEqualTo(RelationLabel.S2_REFINES_S1);
        assertThat(PairClassifier.decide(OracleStatus.TIMEOUT, OracleStatus.UNSAT)).isEqualTo(RelationLabel.UNKNOWN);
        assertThat(PairClassifier.decide(OracleStatus.SAT, OracleStatus.UNKNOWN)).isEqualTo(RelationLabel.UNKNOWN);
        assertThat(PairClassifier.decide(OracleStatus.UNSAT, OracleStatus.ERROR)).isEqualTo(RelationLabel.ERROR);
    }

    @Test
    @DisplayName("Swapping the pair swaps the two refinement labels")
    void inverseConsistency() {
        for (OracleStatus q1 : OracleStatus.values()) {
            for (OracleStatus q2 : OracleStatus.values()) {
                assertThat(PairClassifier.decide(q2, q1)).isEqualTo(PairClassifier.decide(q1, q2).inverse());
            }
        }
    }

    @Test
    @DisplayName("Classifying (b, a) gives the inverse of (a, b)")
    void inverseConsistencyThroughSolver() {
        PairClassifier classifier = new PairClassifier(store, new FakeSolver());

        RelationLabel forward = classifier.classify(ScriptId.of("a"), ScriptId.of("b"));
        RelationLabel backward = classifier.classify(ScriptId.of("b"), ScriptId.of("a"));

        assertThat(backward).isEqualTo(forward.inverse());
    }

    @Test
    @DisplayName("Scripts with identical assertions are equivalent")
    void identicalAssertionsAreEquivalent() {
        PairClassifier classifier = new PairClassifier(store, new FakeSolver());

        assertThat(classifier.classify(ScriptId.of("a"), ScriptId.of("a2"))).isEqualTo(RelationLabel.EQUIVALENT);
        assertThat(classifier.classify(ScriptId.of("a"), ScriptId.of("b"))).isEqualTo(RelationLabel.INCOMPARABLE);
    }

    @Test
    @DisplayName("Should send both directions to the solver")
    void shouldQueryBothDirections() {
        when(oracle.query(anyString())).thenReturn(result(OracleStatus.UNSAT), result(OracleStatus.SAT));

        RelationLabel label = new PairClassifier(store, oracle).classify(ScriptId.of("a"), ScriptId.of("b"));

        assertThat(label).isEqualTo(RelationLabel.S1_REFINES_S2);
        verify(oracle).query("(declare-const x Int)\n(assert (> x 0))\n(assert (not (> x 1)))\n(check-sat)\n");
        verify(oracle).query("(declare-const x Int)\n(assert (> x 1))\n(assert (not (> x 0)))\n(check-sat)\n");
    }

    @Test
    @DisplayName("A timeout yields unknown")
    void timeoutIsUnknown() {
        when(oracle.query(anyString())).thenReturn(OracleResult.timeout(Duration.ofSeconds(600)), result(OracleStatus.UNSAT));

        assertThat(new PairClassifier(store, oracle).classify(ScriptId.of("a"), ScriptId.of("b")))
                .isEqualTo(RelationLabel.UNKNOWN);
    }

    @Test
    @DisplayName("A solver error on the first query skips the second")
    void errorShortCircuits() {
        when(oracle.query(anyString())).thenReturn(OracleResult.error("(error \"line 1\")", Duration.ZERO));

        assertThat(new PairClassifier(store, oracle).classify(ScriptId.of("a"), ScriptId.of("b")))
                .isEqualTo(RelationLabel.ERROR);
        verify(oracle, times(1)).query(anyString());
    }

    @Test
    @DisplayName("Missing or unparseable scripts give ERROR without a solver call")
    void unreadableScriptsAreErrors() {
        PairClassifier classifier = new PairClassifier(store, oracle);

        assertThat(classifier.classify(ScriptId.of("a"), ScriptId.of("missing"))).isEqualTo(RelationLabel.ERROR);
        assertThat(classifier.classify(ScriptId.of("broken"), ScriptId.of("a"))).isEqualTo(RelationLabel.ERROR);
        verifyNoInteractions(oracle);
    }
}
