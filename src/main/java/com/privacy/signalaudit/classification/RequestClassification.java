package com.privacy.signalaudit.classification;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RequestClassification {
    // Lower-case host without port; empty when the URL has no host
    String domain;
    boolean tracker;
    boolean containsPii;
    @Singular
    List<String> piiTypes;
    // Set when the URL could not be parsed; both flags are then false
    String error;

    static RequestClassification failed(String error) {
        return RequestClassification.builder()
                .domain("")
                .error(error)
                .build();
    }
}
