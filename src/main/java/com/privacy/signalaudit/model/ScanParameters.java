package com.privacy.signalaudit.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Resolved, immutable settings for one scan. Passed explicitly to every
 * stage so nothing downstream reads process-wide configuration.
 */
@Value
@Builder
public class ScanParameters {
    String scanId;
    String target;
    @Singular("url")
    List<String> itinerary;
    String jurisdiction;
    Duration perPageTimeout;
    Duration totalTimeout;
    long leakThresholdMs;
    // Session order; the first is the baseline, the second the compliance session
    @Singular
    List<SignalConfig> signalConfigs;
    boolean enrichmentEnabled;
    boolean skipSupersededRules;
}
