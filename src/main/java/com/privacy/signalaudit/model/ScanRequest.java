package com.privacy.signalaudit.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Caller-supplied request for one scan. Null overrides fall back to configured defaults.
 */
@Value
@Builder
@Schema(description = "Request to scan a site")
public class ScanRequest {

    @Schema(description = "Site being audited", example = "https://example.com")
    String target;

    @Schema(description = "Ordered list of URLs visited by every session")
    @Singular("url")
    List<String> itinerary;

    @Schema(description = "Jurisdiction whose rules apply; configured default when null", example = "CCPA")
    String jurisdiction;

    @Schema(description = "Per-page navigation timeout override (ms)", example = "30000")
    Long perPageTimeoutMs;

    @Schema(description = "Total session timeout override (ms)", example = "600000")
    Long totalTimeoutMs;

    @Schema(description = "Leak window override (ms)", example = "500")
    Long leakThresholdMs;

    @Schema(description = "Enable or disable violation enrichment for this scan")
    Boolean enrichmentEnabled;
}
