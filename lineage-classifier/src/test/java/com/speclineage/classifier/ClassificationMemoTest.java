package com.speclineage.classifier;

import com.speclineage.api.IPairClassifier;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClassificationMemoTest {

    private static final ScriptId A = ScriptId.of("a");
    private static final ScriptId B = ScriptId.of("b");

    @Mock
    private IPairClassifier delegate;

    private final InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();

    @Test
    @DisplayName("Should classify each ordered pair once")
    void shouldClassifyOnce() {
        when(delegate.classify(A, B)).thenReturn(RelationLabel.S1_REFINES_S2);
        ClassificationMemo memo = new ClassificationMemo(delegate, 100, metrics);

        assertThat(memo.classify(A, B)).isEqualTo(RelationLabel.S1_REFINES_S2);
        assertThat(memo.classify(A, B)).isEqualTo(RelationLabel.S1_REFINES_S2);
        assertThat(memo.classify(A, B)).isEqualTo(RelationLabel.S1_REFINES_S2);

        verify(delegate, times(1)).classify(A, B);
        assertThat(metrics.counterValue("memo_lookups_total", "result", "hit")).isEqualTo(2);
        assertThat(metrics.counterValue("memo_lookups_total", "result", "miss")).isEqualTo(1);
        assertThat(memo.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Reversed pairs are separate entries")
    void reversedPairIsSeparate() {
        when(delegate.classify(A, B)).thenReturn(RelationLabel.S1_REFINES_S2);
        when(delegate.classify(B, A)).thenReturn(RelationLabel.S2_REFINES_S1);
        ClassificationMemo memo = new ClassificationMemo(delegate, 100, metrics);

        assertThat(memo.classify(A, B)).isEqualTo(RelationLabel.S1_REFINES_S2);
        assertThat(memo.classify(B, A)).isEqualTo(RelationLabel.S2_REFINES_S1);
        assertThat(memo.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Invalidation forgets remembered labels")
    void invalidateAll() {
        when(delegate.classify(A, B)).thenReturn(RelationLabel.EQUIVALENT);
        ClassificationMemo memo = new ClassificationMemo(delegate, 100, metrics);

        memo.classify(A, B);
        memo.invalidateAll();
        memo.classify(A, B);

        verify(delegate, times(2)).classify(A, B);
    }
}
