package com.speclineage.infra.metrics.impl.prometheus;

import com.speclineage.infra.metrics.Counter;
import com.speclineage.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry registry;
    private PrometheusMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusMetricsRegistry(registry);
    }

    @Test
    void counter_isLabelledByTags() {
        Counter sat = metrics.counter("oracle_queries_total", "status", "sat");
        Counter timeout = metrics.counter("oracle_queries_total", "status", "timeout");

        sat.increment();
        sat.increment(2);
        timeout.increment();

        assertThat(sat.count()).isEqualTo(3L);
        assertThat(timeout.count()).isEqualTo(1L);
        assertThat(metrics.counter("oracle_queries_total", "status", "sat").count()).isEqualTo(3L);
    }

    @Test
    void counter_negativeAmount_throwsException() {
        Counter counter = metrics.counter("pruned_pairs_total");

        assertThatThrownBy(() -> counter.increment(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void timer_countsObservations() {
        Timer timer = metrics.timer("oracle_query_duration");

        timer.record(Duration.ofMillis(150));
        timer.record(Duration.ofSeconds(30));

        assertThat(timer.count()).isEqualTo(2L);
        assertThat(registry.getSampleValue("oracle_query_duration_seconds_count")).isEqualTo(2.0);
    }

    @Test
    void sanitizeName_replacesIllegalCharacters() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Memo-Hits.total")).isEqualTo("memo_hits_total");
    }
}
