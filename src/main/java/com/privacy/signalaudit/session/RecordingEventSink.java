package com.privacy.signalaudit.session;

import com.privacy.signalaudit.model.ScanEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Logs every event and keeps a copy for the scan result.
 */
public class RecordingEventSink implements ScanEventSink {

    private static final Logger log = LoggerFactory.getLogger(RecordingEventSink.class);

    private final List<ScanEvent> events = new ArrayList<>();

    @Override
    public void emit(ScanEvent event) {
        synchronized (events) {
            events.add(event);
        }
        switch (event.getLevel()) {
            case ERROR -> log.error("[{}] {}", event.getSource(), event.getMessage());
            case WARNING -> log.warn("[{}] {}", event.getSource(), event.getMessage());
            default -> log.info("[{}] {}", event.getSource(), event.getMessage());
        }
    }

    public List<ScanEvent> getEvents() {
        synchronized (events) {
            return List.copyOf(events);
        }
    }
}
