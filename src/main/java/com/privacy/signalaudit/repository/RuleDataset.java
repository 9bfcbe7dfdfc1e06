package com.privacy.signalaudit.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.privacy.signalaudit.model.Rule;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * On-disk layout of the rule dataset.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuleDataset {
    String version;
    String source;
    List<Rule> rules;
}
