package com.privacy.signalaudit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scan")
public class ScanConfig {

    // Navigation timeout for a single page
    private long perPageTimeoutMs = 30_000;

    // Hard deadline for a whole session. Remaining pages are skipped once it elapses.
    private long totalTimeoutMs = 600_000;

    // Extra time granted to session workers after the total deadline before results are merged
    private long sessionGraceMs = 15_000;

    // Tracker requests fired within this many ms of a page load are temporal leaks
    private long leakThresholdMs = 500;

    // Upper bound on the network-idle wait after DOMContentLoaded
    private long settleTimeoutMs = 10_000;

    // Pause between simulated user actions (scroll steps, consent clicks)
    private long actionDelayMs = 800;

    private int scrollSteps = 3;

    private boolean headless = true;

    // Versioned rule dataset, keyed by jurisdiction
    private String rulesLocation = "classpath:rules/compliance-rules.json";

    // Jurisdiction used when a request names none
    private String defaultJurisdiction = "CCPA";

    // Global Privacy Control signal asserted by the compliance session
    private String signalHeaderName = "Sec-GPC";
    private String signalHeaderValue = "1";
    private String signalScript =
            "Object.defineProperty(navigator, 'globalPrivacyControl', {get: () => true, configurable: true});";

    // Drop rules that a later provision in the dataset supersedes
    private boolean skipSupersededRules = false;

    private String outputDir = "reports";

    // Also write traffic_<label>.json for every session
    private boolean exportSessionLogs = true;

    private String toolName = "signal-audit";
    private String toolVersion = "0.1.0";
}
