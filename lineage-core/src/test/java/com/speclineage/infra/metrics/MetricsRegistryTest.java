package com.speclineage.infra.metrics;

import com.speclineage.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    @Test
    @DisplayName("Highest priority provider on the classpath wins")
    void discoversInMemoryProviderInTests() {
        assertThat(MetricsRegistry.getInstance()).isInstanceOf(InMemoryMetricsRegistry.class);
    }

    @Test
    void inMemoryCountersAreKeyedByTags() {
        InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
        metrics.counter("memo_lookups_total", "result", "hit").increment();
        metrics.counter("memo_lookups_total", "result", "hit").increment();
        metrics.counter("memo_lookups_total", "result", "miss").increment();

        assertThat(metrics.counterValue("memo_lookups_total", "result", "hit")).isEqualTo(2);
        assertThat(metrics.counterValue("memo_lookups_total", "result", "miss")).isEqualTo(1);
        assertThat(metrics.counterValue("memo_lookups_total")).isZero();

        metrics.reset();
        assertThat(metrics.counterValue("memo_lookups_total", "result", "hit")).isZero();
    }
}
