package com.privacy.signalaudit.engine;

import com.privacy.signalaudit.model.NetworkRequest;
import com.privacy.signalaudit.model.PageVisit;
import com.privacy.signalaudit.model.SessionLog;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds tracker requests fired within a short window after a page load.
 *
 * <p>For every page visit the window is {@code [loadTimestamp, loadTimestamp + threshold)}:
 * lower bound inclusive, upper bound exclusive. A tracker request of the same
 * page inside any window is a leak. Each request is reported once, in capture order.
 * Pure and idempotent.
 */
@Component
public class TemporalLeakDetector {

    public List<NetworkRequest> detectLeaks(SessionLog sessionLog, long thresholdMs) {
        List<NetworkRequest> leaks = new ArrayList<>();
        if (thresholdMs <= 0) {
            return leaks;
        }
        for (NetworkRequest request : sessionLog.getRequests()) {
            if (request.isTracker() && findLoadWindow(sessionLog, request, thresholdMs) != null) {
                leaks.add(request);
            }
        }
        return leaks;
    }

    /**
     * The page visit whose leak window contains the request, or null.
     */
    public PageVisit findLoadWindow(SessionLog sessionLog, NetworkRequest request, long thresholdMs) {
        long timestamp = request.getRequestTimestampMs();
        for (PageVisit visit : sessionLog.getPageVisits()) {
            if (!Objects.equals(visit.getUrl(), request.getPageUrl())) {
                continue;
            }
            long start = visit.getLoadTimestampMs();
            if (timestamp >= start && timestamp < start + thresholdMs) {
                return visit;
            }
        }
        return null;
    }
}
