package com.privacy.signalaudit.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@Value
@Schema(description = "Compliance outcome derived from comparing the two sessions")
public class Verdict {

    @Schema(description = "Outcome", example = "NON_COMPLIANT")
    VerdictOutcome outcome;

    @Schema(description = "Tracker hosts contacted in both the baseline and the compliance session",
            example = "[\"doubleclick.net\"]")
    Set<String> domainsIgnoringSignal;

    @Schema(description = "Number of temporal leaks in the compliance session", example = "2")
    int leakCount;

    @Schema(description = "Compliance-session tracker requests fired inside the leak window")
    List<NetworkRequest> temporalLeaks;

    @Builder
    public Verdict(VerdictOutcome outcome, Set<String> domainsIgnoringSignal, List<NetworkRequest> temporalLeaks) {
        this.outcome = outcome;
        this.domainsIgnoringSignal = domainsIgnoringSignal == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(domainsIgnoringSignal));
        this.temporalLeaks = temporalLeaks == null ? List.of() : List.copyOf(temporalLeaks);
        this.leakCount = this.temporalLeaks.size();
    }
}
