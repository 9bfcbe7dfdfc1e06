package com.privacy.signalaudit.engine;

import com.privacy.signalaudit.model.Violation;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of running one detector for one rule. A skipped detector could not
 * evaluate; that is not the same as finding the site compliant.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DetectorOutcome {

    public enum Status {
        TRIGGERED,
        COMPLIANT,
        SKIPPED
    }

    Status status;
    Violation violation;
    String reason;

    public static DetectorOutcome triggered(Violation violation) {
        return new DetectorOutcome(Status.TRIGGERED, violation, null);
    }

    public static DetectorOutcome compliant(String reason) {
        return new DetectorOutcome(Status.COMPLIANT, null, reason);
    }

    public static DetectorOutcome skipped(String reason) {
        return new DetectorOutcome(Status.SKIPPED, null, reason);
    }

    public boolean isTriggered() {
        return status == Status.TRIGGERED;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }
}
