package com.privacy.signalaudit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "A cited violation produced by one detector for one rule")
public class Violation {

    @Schema(description = "Rule identifier", example = "CCPA-1798.135b")
    String ruleId;

    @Schema(description = "Section citation of the rule", example = "§1798.135(b)(1)")
    String sectionCitation;

    @Schema(description = "Title of the rule")
    String ruleTitle;

    @Schema(description = "Kind of behavior detected", example = "SIGNAL_NOT_HONORED")
    ViolationType violationType;

    @Schema(description = "Severity", example = "HIGH")
    Severity severity;

    @Schema(description = "Detector-specific evidence")
    Map<String, Object> evidence;

    @Schema(description = "Minimum penalty (USD)", example = "2500.00")
    BigDecimal penaltyMin;

    @Schema(description = "Maximum penalty (USD)", example = "7500.00")
    BigDecimal penaltyMax;

    @Schema(description = "Remediation advice")
    String recommendation;

    @Schema(description = "Plain-English explanation from an enrichment provider; absent when unavailable")
    String plainEnglish;

    @Schema(description = "Technical fix from an enrichment provider; absent when unavailable")
    String technicalFix;

    @Builder(toBuilder = true)
    public Violation(String ruleId, String sectionCitation, String ruleTitle, ViolationType violationType,
                     Severity severity, Map<String, Object> evidence, BigDecimal penaltyMin, BigDecimal penaltyMax,
                     String recommendation, String plainEnglish, String technicalFix) {
        this.ruleId = ruleId;
        this.sectionCitation = sectionCitation;
        this.ruleTitle = ruleTitle;
        this.violationType = violationType;
        this.severity = severity;
        // Insertion order is kept for the report
        this.evidence = evidence == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        this.penaltyMin = penaltyMin;
        this.penaltyMax = penaltyMax;
        this.recommendation = recommendation;
        this.plainEnglish = plainEnglish;
        this.technicalFix = technicalFix;
    }

    /**
     * Builder pre-filled with the citation and penalty range of the rule.
     */
    public static ViolationBuilder forRule(Rule rule) {
        return Violation.builder()
                .ruleId(rule.getRuleId())
                .sectionCitation(rule.getSectionCitation())
                .ruleTitle(rule.getTitle())
                .penaltyMin(rule.getPenaltyMin())
                .penaltyMax(rule.getPenaltyMax());
    }
}
