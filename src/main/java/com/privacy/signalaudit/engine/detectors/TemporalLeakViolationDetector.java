package com.privacy.signalaudit.engine.detectors;

import com.privacy.signalaudit.engine.DetectionContext;
import com.privacy.signalaudit.engine.DetectorOutcome;
import com.privacy.signalaudit.engine.RuleDetector;
import com.privacy.signalaudit.engine.TemporalLeakDetector;
import com.privacy.signalaudit.model.NetworkRequest;
import com.privacy.signalaudit.model.PageVisit;
import com.privacy.signalaudit.model.Rule;
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
 * Flags tracker requests that fired in the compliance session before the
 * opt-out signal could have been acted on, i.e. inside the leak window that
 * follows each page load.
 */
@Component
public class TemporalLeakViolationDetector implements RuleDetector {

    public static final String KEY = "temporal_leak";

    private static final int SAMPLE_SIZE = 3;

    private final TemporalLeakDetector leakDetector;

    public TemporalLeakViolationDetector(TemporalLeakDetector leakDetector) {
        this.leakDetector = leakDetector;
    }

    @Override
    public String getDetectorKey() {
        return KEY;
    }

    @Override
    public DetectorOutcome detect(Rule rule, DetectionContext context) {
        if (!context.isSignalComparable()) {
            return DetectorOutcome.skipped("sessions are not comparable: verdict is insufficient data");
        }

        List<NetworkRequest> leaks = context.getVerdict().getTemporalLeaks();
        if (leaks.isEmpty()) {
            return DetectorOutcome.compliant("no tracker request inside the "
                    + context.getLeakThresholdMs() + "ms load window");
        }

        TreeSet<String> domains = new TreeSet<>();
        for (NetworkRequest leak : leaks) {
            domains.add(leak.getDomain());
        }

        List<Map<String, Object>> samples = new ArrayList<>();
        for (NetworkRequest leak : EvidenceSamples.first(leaks, SAMPLE_SIZE)) {
            Map<String, Object> sample = new LinkedHashMap<>();
            sample.put("domain", leak.getDomain());
            sample.put("url", EvidenceSamples.abbreviate(leak.getFullUrl()));
            sample.put("pageUrl", leak.getPageUrl());
            PageVisit visit = leakDetector.findLoadWindow(context.getCompliance(), leak, context.getLeakThresholdMs());
            if (visit != null) {
                sample.put("msAfterLoad", leak.getRequestTimestampMs() - visit.getLoadTimestampMs());
            }
            samples.add(sample);
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("leakCount", leaks.size());
        evidence.put("leakedDomains", new ArrayList<>(domains));
        evidence.put("sampleLeaks", samples);
        evidence.put("windowMs", context.getLeakThresholdMs());

        return DetectorOutcome.triggered(Violation.forRule(rule)
                .violationType(ViolationType.TEMPORAL_LEAK)
                .severity(Severity.HIGH)
                .evidence(evidence)
                .recommendation("Trackers fired within " + context.getLeakThresholdMs()
                        + "ms of page load while the opt-out signal was present, so data left the browser "
                        + "before the opt-out could take effect. Block tracker scripts before page load "
                        + "whenever the signal is detected.")
                .build());
    }
}
