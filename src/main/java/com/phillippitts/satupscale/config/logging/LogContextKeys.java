package com.phillippitts.satupscale.config.logging;

/**
 * Log4j2 ThreadContext keys shared by the request filter, the job queue worker and the console
 * pattern in {@code log4j2-spring.xml}.
 */
public final class LogContextKeys {

    public static final String REQUEST_ID = "requestId";
    public static final String JOB_ID = "jobId";
    public static final String METHOD = "method";
    public static final String URI = "uri";

    private LogContextKeys() {
    }
}
