package com.phillippitts.satupscale.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JobMetricsTest {

    private MeterRegistry registry;
    private JobMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new JobMetrics(registry);
    }

    @Test
    void shouldRecordDurationAndOutcomeOfCompletedJob() {
        long durationNanos = TimeUnit.SECONDS.toNanos(3);

        metrics.recordJob(JobMetrics.OUTCOME_COMPLETED, durationNanos);

        Timer timer = registry.find("satupscale.job.duration").tag("outcome", "completed").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos);
        Counter counter = registry.find("satupscale.job.outcome").tag("outcome", "completed").counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldKeepOutcomesSeparate() {
        metrics.recordJob(JobMetrics.OUTCOME_FAILED, 10);
        metrics.recordJob(JobMetrics.OUTCOME_CANCELLED, 10);
        metrics.recordJob(JobMetrics.OUTCOME_CANCELLED, 10);

        assertThat(registry.find("satupscale.job.outcome").tag("outcome", "failed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("satupscale.job.outcome").tag("outcome", "cancelled").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldCountFallbacksPerChainAndStrategy() {
        metrics.incrementFallback("master", "model");
        metrics.incrementFallback("master", "model");
        metrics.incrementFallback("visual", "model");

        Counter master = registry.find("satupscale.upscale.fallback")
                .tag("chain", "master")
                .tag("strategy", "model")
                .counter();
        assertThat(master).isNotNull();
        assertThat(master.count()).isEqualTo(2.0);
    }

    @Test
    void shouldCountExhaustedChains() {
        metrics.incrementExhausted("visual");

        Counter counter = registry.find("satupscale.upscale.exhausted").tag("chain", "visual").counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }
}
