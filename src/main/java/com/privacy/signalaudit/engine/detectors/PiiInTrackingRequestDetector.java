package com.privacy.signalaudit.engine.detectors;

import com.privacy.signalaudit.engine.DetectionContext;
import com.privacy.signalaudit.engine.DetectorOutcome;
import com.privacy.signalaudit.engine.RuleDetector;
import com.privacy.signalaudit.model.NetworkRequest;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.Severity;
import com.privacy.signalaudit.model.Violation;
import com.privacy.signalaudit.model.ViolationType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Tracker requests whose URL carries personal data (emails, user ids, hashed ids, ...).
 * Requests of both sessions are considered.
 */
@Component
public class PiiInTrackingRequestDetector implements RuleDetector {

    public static final String KEY = "pii_in_tracking_request";

    private static final int SAMPLE_SIZE = 5;

    @Override
    public String getDetectorKey() {
        return KEY;
    }

    @Override
    public DetectorOutcome detect(Rule rule, DetectionContext context) {
        SessionLog baseline = context.getBaseline();
        SessionLog compliance = context.getCompliance();
        if (baseline.getSuccessfulPageCount() == 0 && compliance.getSuccessfulPageCount() == 0) {
            return DetectorOutcome.skipped("no page loaded in either session");
        }

        List<NetworkRequest> hits = new ArrayList<>();
        collectHits(baseline, hits);
        collectHits(compliance, hits);
        if (hits.isEmpty()) {
            return DetectorOutcome.compliant("no personal data found in tracker request URLs");
        }

        TreeSet<String> domains = new TreeSet<>();
        for (NetworkRequest hit : hits) {
            domains.add(hit.getDomain());
        }
        List<Map<String, Object>> samples = new ArrayList<>();
        for (NetworkRequest hit : EvidenceSamples.first(hits, SAMPLE_SIZE)) {
            Map<String, Object> sample = new LinkedHashMap<>();
            sample.put("session", hit.getSessionLabel());
            sample.put("domain", hit.getDomain());
            sample.put("url", EvidenceSamples.abbreviate(hit.getFullUrl()));
            sample.put("piiTypes", hit.getPiiTypes());
            samples.add(sample);
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("totalPiiHits", hits.size());
        evidence.put("piiDomains", new ArrayList<>(domains));
        evidence.put("sampleHits", samples);

        return DetectorOutcome.triggered(Violation.forRule(rule)
                .violationType(ViolationType.PII_IN_TRACKING_REQUEST)
                .severity(Severity.MEDIUM)
                .evidence(evidence)
                .recommendation("Remove or anonymize personal data in outbound tracker URLs. "
                        + "Never pass emails, phone numbers or hashed identifiers as beacon parameters.")
                .build());
    }

    private static void collectHits(SessionLog sessionLog, List<NetworkRequest> hits) {
        for (NetworkRequest request : sessionLog.getRequests()) {
            if (request.isTracker() && request.isContainsPii()) {
                hits.add(request);
            }
        }
    }
}
