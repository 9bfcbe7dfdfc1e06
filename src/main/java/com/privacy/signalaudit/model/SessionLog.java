package com.privacy.signalaudit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Frozen record of one browsing session: page visits and captured requests,
 * both in capture order.
 */
@Value
@Schema(description = "Captured evidence of one browsing session")
public class SessionLog {

    @Schema(description = "Session label", example = "baseline")
    String label;

    @Schema(description = "Page visits in itinerary order")
    List<PageVisit> pageVisits;

    @Schema(description = "Captured requests in capture order")
    List<NetworkRequest> requests;

    @Schema(description = "Whether the session hit its total timeout before finishing the itinerary")
    boolean timedOut;

    @Schema(description = "Whether the session was aborted by a fatal browser failure")
    boolean aborted;

    @Schema(description = "Reason for the abort, if any")
    String abortReason;

    @Builder
    public SessionLog(String label, List<PageVisit> pageVisits, List<NetworkRequest> requests,
                      boolean timedOut, boolean aborted, String abortReason) {
        this.label = label;
        this.pageVisits = pageVisits == null ? List.of() : List.copyOf(pageVisits);
        this.requests = requests == null ? List.of() : List.copyOf(requests);
        this.timedOut = timedOut;
        this.aborted = aborted;
        this.abortReason = abortReason;
    }

    public static SessionLog empty(String label) {
        return SessionLog.builder().label(label).build();
    }

    /**
     * Distinct hosts of tracker requests, sorted.
     */
    @Schema(description = "Distinct tracker hosts contacted during the session")
    public Set<String> getTrackerDomains() {
        Set<String> domains = new TreeSet<>();
        for (NetworkRequest request : requests) {
            if (request.isTracker() && request.getDomain() != null && !request.getDomain().isEmpty()) {
                domains.add(request.getDomain());
            }
        }
        return Collections.unmodifiableSet(domains);
    }

    @JsonIgnore
    public long getTrackerRequestCount() {
        return requests.stream().filter(NetworkRequest::isTracker).count();
    }

    @JsonIgnore
    public int getSuccessfulPageCount() {
        return (int) pageVisits.stream().filter(PageVisit::isLoaded).count();
    }

    @JsonIgnore
    public List<PageVisit> getLoadedPages() {
        return pageVisits.stream().filter(PageVisit::isLoaded).toList();
    }
}
