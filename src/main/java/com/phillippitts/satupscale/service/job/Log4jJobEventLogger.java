package com.phillippitts.satupscale.service.job;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.StringMapMessage;

import java.util.Map;
import java.util.Objects;

/**
 * {@link JobEventLogger} that renders each event as a Log4j2 {@link StringMapMessage} on the
 * {@value #EVENTS_LOGGER} logger. The JSON-lines appender in {@code log4j2-spring.xml} writes
 * these one object per line.
 */
public final class Log4jJobEventLogger implements JobEventLogger {

    public static final String EVENTS_LOGGER = "satupscale.events";

    private final Logger logger;
    private final String component;

    public Log4jJobEventLogger(String component) {
        this(LogManager.getLogger(EVENTS_LOGGER), component);
    }

    Log4jJobEventLogger(Logger logger, String component) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.component = Objects.requireNonNull(component, "component");
    }

    @Override
    public void logEvent(Level level, String event, String message, Map<String, Object> fields) {
        if (!logger.isEnabled(level)) {
            return;
        }
        StringMapMessage payload = new StringMapMessage()
                .with("level", level.name())
                .with("component", component)
                .with("event", event)
                .with("message", message);
        if (fields != null) {
            fields.forEach((key, value) -> {
                if (value != null) {
                    payload.with(key, String.valueOf(value));
                }
            });
        }
        logger.log(level, payload);
    }

    public String component() {
        return component;
    }
}
