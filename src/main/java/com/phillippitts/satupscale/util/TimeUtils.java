package com.phillippitts.satupscale.util;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Time conversions shared by process timing and processing reports.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    /** Second-precision UTC timestamps such as {@code 2024-05-01T12:00:00Z}. */
    public static final DateTimeFormatter ISO_UTC_SECONDS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /** Formats an instant as {@link #ISO_UTC_SECONDS}, dropping fractional seconds. */
    public static String formatUtcSeconds(Instant instant) {
        return ISO_UTC_SECONDS.format(instant.truncatedTo(ChronoUnit.SECONDS));
    }
}
