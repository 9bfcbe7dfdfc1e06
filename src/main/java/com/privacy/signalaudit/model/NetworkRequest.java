package com.privacy.signalaudit.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Outbound HTTP request observed during a browsing session")
public class NetworkRequest {

    @Schema(description = "Label of the owning session", example = "compliance")
    String sessionLabel;

    @Schema(description = "URL of the owning page visit", example = "https://example.com/")
    String pageUrl;

    @Schema(description = "Index of the owning page visit", example = "0")
    int visitIndex;

    @Schema(description = "Session-local monotonic capture timestamp (ms)", example = "1720")
    long requestTimestampMs;

    @Schema(description = "Request host, lower-cased", example = "stats.g.doubleclick.net")
    String domain;

    @Schema(description = "Full request URL")
    String fullUrl;

    @Schema(description = "HTTP method", example = "GET")
    String method;

    @Schema(description = "Browser resource type", example = "script")
    String resourceType;

    @Schema(description = "Whether the host matched the tracker-domain table", example = "true")
    boolean tracker;

    @Schema(description = "Whether the URL matched any PII pattern", example = "false")
    boolean containsPii;

    @Schema(description = "Names of the PII patterns that matched", example = "[\"email_param\"]")
    @Singular
    List<String> piiTypes;

    @Schema(description = "Set when classification failed; both flags are then false")
    String classificationError;
}
