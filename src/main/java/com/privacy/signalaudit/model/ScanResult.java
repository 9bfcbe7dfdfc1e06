package com.privacy.signalaudit.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ScanResult {
    EvidenceReport report;
    // Keyed by session label, in session order
    Map<String, SessionLog> sessionLogs;
    List<ScanEvent> events;
}
