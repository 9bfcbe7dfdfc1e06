package com.privacy.signalaudit.session;

import com.privacy.signalaudit.classification.RequestClassification;
import com.privacy.signalaudit.classification.RequestClassifier;
import com.privacy.signalaudit.model.NetworkRequest;
import com.privacy.signalaudit.model.PageVisit;
import com.privacy.signalaudit.model.SessionLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Append-only capture of one session's page visits and outbound requests.
 *
 * <p>Every append takes its timestamp from the session clock while holding the
 * recorder lock, so capture order never goes backwards in time and nothing is
 * appended after {@link #freeze} returns. Requests are attributed to the page
 * most recently started with {@link #beginPage}.
 */
public class TrafficRecorder implements RequestListener {

    private static final Logger log = LoggerFactory.getLogger(TrafficRecorder.class);

    private final String sessionLabel;
    private final SessionClock clock;
    private final RequestClassifier classifier;

    private final List<PageVisit> pageVisits = new ArrayList<>();
    private final List<NetworkRequest> requests = new ArrayList<>();
    private final Set<RequestKey> seen = new HashSet<>();

    private int currentIndex = -1;
    private String currentUrl;
    private long currentLoadTimestamp;
    private boolean currentRecorded = true;

    private SessionLog frozen;

    public TrafficRecorder(String sessionLabel, SessionClock clock, RequestClassifier classifier) {
        this.sessionLabel = sessionLabel;
        this.clock = clock;
        this.classifier = classifier;
    }

    /**
     * Mark the start of a navigation. Returns the load timestamp of the page.
     */
    public synchronized long beginPage(int index, String url) {
        if (frozen != null) {
            throw new IllegalStateException("Session log '" + sessionLabel + "' is frozen");
        }
        closeUnrecordedPage("navigation superseded");
        currentIndex = index;
        currentUrl = url;
        currentLoadTimestamp = clock.nowMs();
        currentRecorded = false;
        return currentLoadTimestamp;
    }

    /**
     * Record the outcome of the page started last.
     */
    public synchronized void recordPage(PageVisit visit) {
        if (frozen != null) {
            log.debug("Session {} frozen, page outcome for {} not recorded", sessionLabel, visit.getUrl());
            return;
        }
        pageVisits.add(visit);
        if (visit.getIndex() == currentIndex) {
            currentRecorded = true;
        }
    }

    @Override
    public synchronized void onRequest(String url, String method, String resourceType) {
        if (frozen != null) {
            log.debug("Session {} frozen, request after freeze not recorded: {} {}", sessionLabel, method, url);
            return;
        }
        if (currentUrl == null) {
            log.debug("Session {} has no active page, request not attributable: {} {}", sessionLabel, method, url);
            return;
        }

        long timestamp = clock.nowMs();
        if (!seen.add(new RequestKey(timestamp, url, method))) {
            log.debug("Session {} duplicate request at {}ms: {} {}", sessionLabel, timestamp, method, url);
            return;
        }

        RequestClassification classification = classifier.classify(url);
        requests.add(NetworkRequest.builder()
                .sessionLabel(sessionLabel)
                .pageUrl(currentUrl)
                .visitIndex(currentIndex)
                .requestTimestampMs(timestamp)
                .domain(classification.getDomain())
                .fullUrl(url)
                .method(method)
                .resourceType(resourceType)
                .tracker(classification.isTracker())
                .containsPii(classification.isContainsPii())
                .piiTypes(classification.getPiiTypes())
                .classificationError(classification.getError())
                .build());
    }

    /**
     * Freeze the log. The first call wins; later calls return the same log.
     */
    public synchronized SessionLog freeze(boolean timedOut, boolean aborted, String abortReason) {
        if (frozen == null) {
            closeUnrecordedPage(timedOut ? "session timed out" : "session ended");
            frozen = SessionLog.builder()
                    .label(sessionLabel)
                    .pageVisits(pageVisits)
                    .requests(requests)
                    .timedOut(timedOut)
                    .aborted(aborted)
                    .abortReason(abortReason)
                    .build();
            log.debug("Session {} frozen: {} pages, {} requests", sessionLabel, pageVisits.size(), requests.size());
        }
        return frozen;
    }

    public synchronized boolean isFrozen() {
        return frozen != null;
    }

    public String getSessionLabel() {
        return sessionLabel;
    }

    // A started page without an outcome still owns its requests, so it is kept as FAILED
    private void closeUnrecordedPage(String reason) {
        if (currentUrl != null && !currentRecorded) {
            pageVisits.add(PageVisit.failed(currentIndex, currentUrl, currentLoadTimestamp, reason));
            currentRecorded = true;
        }
    }

    private record RequestKey(long timestamp, String url, String method) {
    }
}
