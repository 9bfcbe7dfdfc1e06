package com.privacy.signalaudit.engine.detectors;

import com.privacy.signalaudit.engine.DetectionContext;
import com.privacy.signalaudit.engine.DetectorOutcome;
import com.privacy.signalaudit.engine.RuleDetector;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.Severity;
import com.privacy.signalaudit.model.Violation;
import com.privacy.signalaudit.model.ViolationType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Detects tracker hosts that keep receiving requests after the opt-out signal is sent.
 *
 * Logic: a tracker host contacted in the baseline session and again in the
 * compliance session ignored the signal. Hosts seen only without the signal
 * are fine. Evidence also carries how much tracker traffic dropped overall.
 */
@Component
public class SignalNotHonoredDetector implements RuleDetector {

    public static final String KEY = "signal_not_honored";

    @Override
    public String getDetectorKey() {
        return KEY;
    }

    @Override
    public DetectorOutcome detect(Rule rule, DetectionContext context) {
        if (!context.isSignalComparable()) {
            return DetectorOutcome.skipped("sessions are not comparable: verdict is insufficient data");
        }

        Set<String> ignoring = context.getVerdict().getDomainsIgnoringSignal();
        if (ignoring.isEmpty()) {
            return DetectorOutcome.compliant("no tracker host contacted in both sessions");
        }

        long baselineCount = context.getBaseline().getTrackerRequestCount();
        long complianceCount = context.getCompliance().getTrackerRequestCount();

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("domainsIgnoringSignal", new ArrayList<>(ignoring));
        evidence.put("baselineTrackerRequests", baselineCount);
        evidence.put("complianceTrackerRequests", complianceCount);
        evidence.put("reductionPercent", reductionPercent(baselineCount, complianceCount));

        return DetectorOutcome.triggered(Violation.forRule(rule)
                .violationType(ViolationType.SIGNAL_NOT_HONORED)
                .severity(Severity.HIGH)
                .evidence(evidence)
                .recommendation("Stop every third-party tracker request once a request carries the "
                        + "opt-out preference signal (Sec-GPC: 1) and treat it as a valid opt-out of sale and sharing.")
                .build());
    }

    static double reductionPercent(long baselineCount, long complianceCount) {
        BigDecimal ratio = BigDecimal.valueOf(complianceCount)
                .divide(BigDecimal.valueOf(Math.max(baselineCount, 1)), 6, RoundingMode.HALF_UP);
        return BigDecimal.ONE.subtract(ratio)
                .multiply(BigDecimal.valueOf(100))
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
