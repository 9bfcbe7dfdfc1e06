package com.privacy.signalaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Legal provision from the static rule dataset")
public class Rule {

    @Schema(description = "Unique rule identifier", example = "CCPA-1798.135b")
    String ruleId;

    @Schema(description = "Jurisdiction key the rule is loaded under", example = "CCPA")
    String jurisdiction;

    @Schema(description = "Section citation", example = "§1798.135(b)(1)")
    String sectionCitation;

    @Schema(description = "Short title of the provision",
            example = "Honor Opt-Out Preference Signals (Global Privacy Control)")
    String title;

    @Schema(description = "Provision text, passed to enrichment providers")
    String ruleText;

    @Schema(description = "Key of the detector that evaluates this rule; null when no detector applies",
            example = "signal_not_honored")
    String detectorKey;

    @Schema(description = "Minimum penalty per violation (USD); null for definitional rules", example = "2500.00")
    BigDecimal penaltyMin;

    @Schema(description = "Maximum penalty per violation (USD); null for definitional rules", example = "7500.00")
    BigDecimal penaltyMax;

    @Schema(description = "Who the provision applies to", example = "All businesses collecting information online")
    String appliesTo;

    @Schema(description = "Id of an earlier provision this one amends, if any", example = "CCPA-1798.120")
    String supersedes;

    /**
     * Definitional rules carry no penalty and never produce violations.
     */
    @JsonIgnore
    public boolean isDefinitional() {
        return penaltyMin == null && penaltyMax == null;
    }
}
