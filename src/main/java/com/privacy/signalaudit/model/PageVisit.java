package com.privacy.signalaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "One navigation within a browsing session")
public class PageVisit {

    @Schema(description = "Position of the visit within its session, starting at 0", example = "0")
    int index;

    @Schema(description = "Itinerary URL that was navigated to", example = "https://example.com/privacy")
    String url;

    @Schema(description = "Session-local monotonic timestamp at which navigation started (ms)", example = "1520")
    long loadTimestampMs;

    @Schema(description = "Whether a cookie/consent banner was visible", example = "true")
    boolean cookieBannerPresent;

    @Schema(description = "Whether a 'Do Not Sell or Share' style opt-out link was found", example = "false")
    boolean optOutLinkPresent;

    @Schema(description = "Navigation outcome", example = "LOADED")
    PageStatus status;

    @Schema(description = "Failure detail when status is FAILED", example = "Timeout 30000ms exceeded")
    String failureReason;

    @Schema(description = "Consent reject simulation outcome", example = "REJECTED")
    @Builder.Default
    ConsentAction consentAction = ConsentAction.NOT_ATTEMPTED;

    @JsonIgnore
    public boolean isLoaded() {
        return status == PageStatus.LOADED;
    }

    public static PageVisit failed(int index, String url, long loadTimestampMs, String reason) {
        return PageVisit.builder()
                .index(index)
                .url(url)
                .loadTimestampMs(loadTimestampMs)
                .status(PageStatus.FAILED)
                .failureReason(reason)
                .build();
    }
}
