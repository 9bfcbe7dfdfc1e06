package com.privacy.signalaudit.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@Schema(description = "Structured progress event emitted while a scan runs")
public class ScanEvent {

    public static final String SYSTEM_SOURCE = "system";

    @Schema(description = "Wall-clock time the event was emitted")
    Instant timestamp;

    @Schema(description = "Session label, or 'system' for scan-level events", example = "baseline")
    String source;

    @Schema(description = "Event level", example = "WARNING")
    EventLevel level;

    @Schema(description = "Human-readable message")
    String message;
}
