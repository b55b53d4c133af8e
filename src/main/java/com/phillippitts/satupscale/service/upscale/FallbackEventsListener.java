package com.phillippitts.satupscale.service.upscale;

import com.phillippitts.satupscale.service.metrics.JobMetrics;
import com.phillippitts.satupscale.service.upscale.event.AllStrategiesFailedEvent;
import com.phillippitts.satupscale.service.upscale.event.UpscaleFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Logs upscale fallback events succinctly and counts them. */
@Component
class FallbackEventsListener {
    private static final Logger LOG = LogManager.getLogger(FallbackEventsListener.class);

    private final JobMetrics metrics;

    FallbackEventsListener(JobMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onFallback(UpscaleFallbackEvent e) {
        LOG.warn("Upscale fallback: chain={}, strategy={}, reason={}", e.chain(), e.strategy(), e.reason());
        metrics.incrementFallback(e.chain(), e.strategy());
    }

    @EventListener
    void onAllFailed(AllStrategiesFailedEvent e) {
        LOG.warn("All upscale strategies failed: chain={}, reason={}", e.chain(), e.reason());
        metrics.incrementExhausted(e.chain());
    }
}
