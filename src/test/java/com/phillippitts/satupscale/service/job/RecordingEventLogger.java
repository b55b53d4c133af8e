package com.phillippitts.satupscale.service.job;

import org.apache.logging.log4j.Level;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/** Captures structured job events for assertions. */
final class RecordingEventLogger implements JobEventLogger {

    record Entry(Level level, String event, Map<String, Object> fields) {}

    final List<Entry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void logEvent(Level level, String event, String message, Map<String, Object> fields) {
        entries.add(new Entry(level, event, fields));
    }

    List<String> eventNames() {
        return entries.stream().map(Entry::event).toList();
    }

    Entry first(String event) {
        return entries.stream().filter(e -> e.event().equals(event)).findFirst().orElseThrow();
    }
}
