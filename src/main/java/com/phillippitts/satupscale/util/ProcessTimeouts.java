package com.phillippitts.satupscale.util;

import java.time.Duration;

/**
 * Timeout values for child process and helper thread lifecycle.
 *
 * <p>Used by {@link com.phillippitts.satupscale.service.model.ProcessModelInvoker} when waiting
 * for stream gobblers and terminating model processes.
 */
public final class ProcessTimeouts {

    /**
     * Time allowed for stream gobblers to flush buffered output after the process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of gobbler threads during cleanup; they are daemons. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
