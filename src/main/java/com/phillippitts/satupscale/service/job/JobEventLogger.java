package com.phillippitts.satupscale.service.job;

import org.apache.logging.log4j.Level;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured event sink for job telemetry: {@code (level, event, message, fields...)}.
 *
 * <p>Optional collaborator of {@link JobRunner}; {@link #noop()} is used when none is attached.
 */
public interface JobEventLogger {

    void logEvent(Level level, String event, String message, Map<String, Object> fields);

    static JobEventLogger noop() {
        return (level, event, message, fields) -> { };
    }

    /**
     * Builds an ordered field map from alternating keys and values. Null values are skipped
     * so optional fields simply do not appear in the event.
     */
    static Map<String, Object> fields(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("fields require key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                map.put(String.valueOf(keyValues[i]), value);
            }
        }
        return Collections.unmodifiableMap(map);
    }
}
