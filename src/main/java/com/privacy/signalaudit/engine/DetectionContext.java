package com.privacy.signalaudit.engine;

import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.Verdict;
import com.privacy.signalaudit.model.VerdictOutcome;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only inputs shared by all detectors of one scan.
 */
@Value
@Builder
public class DetectionContext {
    SessionLog baseline;
    SessionLog compliance;
    Verdict verdict;
    // Leak window the verdict was computed with
    long leakThresholdMs;

    public boolean isSignalComparable() {
        return verdict != null && verdict.getOutcome() != VerdictOutcome.INSUFFICIENT_DATA;
    }
}
