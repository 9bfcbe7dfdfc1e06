package com.privacy.signalaudit.model;

import lombok.Builder;
import lombok.Value;

/**
 * Explanations returned by an enrichment provider for one violation.
 */
@Value
@Builder
public class Enrichment {
    String plainEnglish;
    String technicalFix;
}
