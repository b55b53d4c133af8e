package com.phillippitts.satupscale.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for upscale jobs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Job duration and outcome (completed, failed, cancelled)</li>
 *   <li>Fallbacks taken per chain and strategy</li>
 *   <li>Chains whose every strategy failed</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class JobMetrics {

    private static final String METRIC_PREFIX = "satupscale";

    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_CANCELLED = "cancelled";

    private final MeterRegistry registry;

    public JobMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the wall time of a finished job and counts its outcome.
     *
     * @param outcome one of {@link #OUTCOME_COMPLETED}, {@link #OUTCOME_FAILED}, {@link #OUTCOME_CANCELLED}
     */
    public void recordJob(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".job.duration")
                .description("Time taken to run an upscale job")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".job.outcome")
                .description("Number of finished upscale jobs by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementFallback(String chain, String strategy) {
        Counter.builder(METRIC_PREFIX + ".upscale.fallback")
                .description("Number of failed upscale strategies that triggered a fallback")
                .tag("chain", chain)
                .tag("strategy", strategy)
                .register(registry)
                .increment();
    }

    public void incrementExhausted(String chain) {
        Counter.builder(METRIC_PREFIX + ".upscale.exhausted")
                .description("Number of upscale chains where every strategy failed")
                .tag("chain", chain)
                .register(registry)
                .increment();
    }
}
