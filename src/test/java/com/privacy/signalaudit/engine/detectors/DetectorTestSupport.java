package com.privacy.signalaudit.engine.detectors;

import com.privacy.signalaudit.engine.DetectionContext;
import com.privacy.signalaudit.engine.TemporalLeakDetector;
import com.privacy.signalaudit.engine.VerdictEngine;
import com.privacy.signalaudit.model.SessionLog;

final class DetectorTestSupport {

    static final long THRESHOLD_MS = 500;

    private DetectorTestSupport() {}

    static DetectionContext context(SessionLog baseline, SessionLog compliance) {
        return DetectionContext.builder()
                .baseline(baseline)
                .compliance(compliance)
                .verdict(new VerdictEngine(new TemporalLeakDetector()).computeVerdict(baseline, compliance, THRESHOLD_MS))
                .leakThresholdMs(THRESHOLD_MS)
                .build();
    }
}
