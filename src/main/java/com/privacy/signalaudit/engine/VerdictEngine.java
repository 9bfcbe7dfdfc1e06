package com.privacy.signalaudit.engine;

import com.privacy.signalaudit.model.NetworkRequest;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.Verdict;
import com.privacy.signalaudit.model.VerdictOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares the baseline and compliance sessions.
 *
 * <p>Tracker hosts contacted in both sessions ignored the signal. Hosts seen
 * only in the baseline are irrelevant, and timestamps are never compared
 * across sessions. If either session loaded no page the comparison is
 * INSUFFICIENT_DATA, whatever fragments were captured.
 */
@Component
public class VerdictEngine {

    private static final Logger log = LoggerFactory.getLogger(VerdictEngine.class);

    private final TemporalLeakDetector leakDetector;

    public VerdictEngine(TemporalLeakDetector leakDetector) {
        this.leakDetector = leakDetector;
    }

    public Verdict computeVerdict(SessionLog baseline, SessionLog compliance, long thresholdMs) {
        Set<String> ignoring = new TreeSet<>(baseline.getTrackerDomains());
        ignoring.retainAll(compliance.getTrackerDomains());
        List<NetworkRequest> leaks = leakDetector.detectLeaks(compliance, thresholdMs);

        VerdictOutcome outcome;
        if (baseline.getSuccessfulPageCount() == 0 || compliance.getSuccessfulPageCount() == 0) {
            outcome = VerdictOutcome.INSUFFICIENT_DATA;
        } else if (!ignoring.isEmpty() || !leaks.isEmpty()) {
            outcome = VerdictOutcome.NON_COMPLIANT;
        } else {
            outcome = VerdictOutcome.COMPLIANT;
        }

        log.info("Verdict {}: {} domains ignoring signal, {} temporal leaks (baseline loaded {}, compliance loaded {})",
                outcome, ignoring.size(), leaks.size(),
                baseline.getSuccessfulPageCount(), compliance.getSuccessfulPageCount());

        return Verdict.builder()
                .outcome(outcome)
                .domainsIgnoringSignal(ignoring)
                .temporalLeaks(leaks)
                .build();
    }
}
