package com.privacy.signalaudit.session;

import com.privacy.signalaudit.model.EventLevel;
import com.privacy.signalaudit.model.ScanEvent;

import java.time.Instant;

/**
 * Receives progress events of a scan. Implementations must be thread-safe:
 * sessions emit concurrently.
 */
public interface ScanEventSink {

    void emit(ScanEvent event);

    default void info(String source, String message) {
        emit(source, EventLevel.INFO, message);
    }

    default void warning(String source, String message) {
        emit(source, EventLevel.WARNING, message);
    }

    default void error(String source, String message) {
        emit(source, EventLevel.ERROR, message);
    }

    default void success(String source, String message) {
        emit(source, EventLevel.SUCCESS, message);
    }

    private void emit(String source, EventLevel level, String message) {
        emit(ScanEvent.builder()
                .timestamp(Instant.now())
                .source(source)
                .level(level)
                .message(message)
                .build());
    }
}
