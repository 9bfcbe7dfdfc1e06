package com.privacy.signalaudit.engine;

import com.privacy.signalaudit.model.Rule;

/**
 * Interface for all violation detectors.
 * Each implementation handles the rules carrying its detector key.
 */
public interface RuleDetector {

    /**
     * The detector key of the rules this detector evaluates.
     */
    String getDetectorKey();

    /**
     * Check the captured sessions against a rule. Must not modify the context.
     *
     * @param rule    the rule being evaluated (citation, penalties)
     * @param context both session logs, the verdict and the leak window
     * @return triggered with a violation, compliant, or skipped when prerequisites are missing
     */
    DetectorOutcome detect(Rule rule, DetectionContext context);
}
