package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.service.metrics.JobMetrics;
import com.phillippitts.satupscale.service.upscale.event.AllStrategiesFailedEvent;
import com.phillippitts.satupscale.service.upscale.event.UpscaleFallbackEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackEventsListenerTest {

    @Test
    void countsFallbacksAndExhaustedChains() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        FallbackEventsListener listener = new FallbackEventsListener(new JobMetrics(registry));

        listener.onFallback(new UpscaleFallbackEvent("master", "geospatial-rewrite",
                "RasterUnavailableException", Instant.now()));
        listener.onAllFailed(new AllStrategiesFailedEvent("visual", "IOException", Instant.now()));

        assertThat(registry.find("satupscale.upscale.fallback")
                .tag("strategy", "geospatial-rewrite").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("satupscale.upscale.exhausted")
                .tag("chain", "visual").counter().count()).isEqualTo(1.0);
    }
}
