package com.privacy.signalaudit.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Value
@Builder
@Schema(description = "Self-contained evidence report for one scan")
public class EvidenceReport {

    @Schema(description = "Report metadata")
    ReportMetadata reportMetadata;

    @Schema(description = "Per-session summaries keyed by session label, in session order")
    Map<String, SessionSummary> sessionSummary;

    @Schema(description = "Verdict computed from the baseline and compliance sessions")
    Verdict verdict;

    @Schema(description = "Totals over the violation list")
    ViolationSummary violationSummary;

    @Schema(description = "Violations in rule dataset order")
    @Singular
    List<Violation> violations;

    @Schema(description = "Overall outcome", example = "VIOLATIONS_FOUND")
    ReportOutcome outcome;

    @Value
    @Builder
    public static class ReportMetadata {

        @Schema(description = "Tool name", example = "signal-audit")
        String tool;

        @Schema(description = "Tool version", example = "0.1.0")
        String version;

        @Schema(description = "Unique id of the scan")
        String scanId;

        @Schema(description = "Scanned target", example = "https://example.com")
        String target;

        @Schema(description = "Jurisdiction the rules were loaded for", example = "CCPA")
        String jurisdiction;

        @Schema(description = "Time the report was generated")
        Instant generatedAt;

        @Schema(description = "Wall-clock duration of the scan in seconds", example = "42.3")
        double elapsedSeconds;

        @Schema(description = "Leak window used by the temporal leak detector (ms)", example = "500")
        long leakThresholdMs;

        @Schema(description = "Number of itinerary entries", example = "12")
        int itinerarySize;

        @Schema(description = "Session-fatal conditions observed during the scan")
        @Singular
        List<String> warnings;
    }

    @Value
    @Builder
    public static class SessionSummary {

        @Schema(description = "Pages attempted", example = "12")
        int pagesVisited;

        @Schema(description = "Pages that loaded", example = "11")
        int pagesLoaded;

        @Schema(description = "Captured requests", example = "348")
        int totalRequests;

        @Schema(description = "Captured tracker requests", example = "41")
        long trackerRequests;

        @Schema(description = "Distinct tracker hosts, sorted")
        Set<String> trackerDomains;

        @Schema(description = "Session hit the total timeout", example = "false")
        boolean timedOut;

        @Schema(description = "Session aborted by a fatal failure", example = "false")
        boolean aborted;
    }

    @Value
    @Builder
    public static class ViolationSummary {

        @Schema(description = "Number of violations", example = "3")
        int total;

        @Schema(description = "Violation count per severity; every level is present")
        Map<Severity, Integer> severityBreakdown;

        @Schema(description = "Sum of penaltyMax over all violations (USD)", example = "22500.00")
        BigDecimal maxPotentialPenaltyUsd;
    }
}
