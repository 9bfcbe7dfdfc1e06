package com.privacy.signalaudit.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Privacy posture asserted by one browsing session. Built once per scan and
 * never changed after the session starts.
 */
@Value
@Builder
@Schema(description = "Privacy signal posture of a single browsing session")
public class SignalConfig {

    public static final String BASELINE_LABEL = "baseline";
    public static final String COMPLIANCE_LABEL = "compliance";

    @Schema(description = "Session label", example = "compliance")
    String label;

    @Schema(description = "Headers added to every request of the session", example = "{\"Sec-GPC\": \"1\"}")
    @Singular
    Map<String, String> httpHeaders;

    @Schema(description = "Init scripts evaluated before any page script, in order")
    @Singular
    List<String> scriptOverrides;

    @Schema(description = "Whether the session clicks a consent 'reject' control when one is shown", example = "true")
    boolean simulateRejectAction;

    public static SignalConfig baseline() {
        return SignalConfig.builder()
                .label(BASELINE_LABEL)
                .simulateRejectAction(false)
                .build();
    }

    public static SignalConfig compliance(String headerName, String headerValue, String script) {
        return SignalConfig.builder()
                .label(COMPLIANCE_LABEL)
                .httpHeader(headerName, headerValue)
                .scriptOverride(script)
                .simulateRejectAction(true)
                .build();
    }
}
