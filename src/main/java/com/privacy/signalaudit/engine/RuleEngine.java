package com.privacy.signalaudit.engine;

import com.privacy.signalaudit.config.MetricsConfig;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.Verdict;
import com.privacy.signalaudit.model.Violation;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every applicable rule of the dataset against the captured sessions.
 * Uses the Strategy pattern: each detector key is handled by a registered RuleDetector.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<String, RuleDetector> detectorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public RuleEngine(List<RuleDetector> detectors, Tracer tracer, MetricsConfig metricsConfig) {
        this.detectorMap = new HashMap<>();
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all detector implementations
        for (RuleDetector detector : detectors) {
            RuleDetector previous = detectorMap.put(detector.getDetectorKey(), detector);
            if (previous != null) {
                throw new IllegalStateException("Two detectors registered for key " + detector.getDetectorKey()
                        + ": " + previous.getClass().getSimpleName() + ", " + detector.getClass().getSimpleName());
            }
            log.info("Registered rule detector: {} -> {}",
                    detector.getDetectorKey(), detector.getClass().getSimpleName());
        }
    }

    public List<Violation> evaluate(List<Rule> rules, SessionLog baseline, SessionLog compliance,
                                    Verdict verdict, long leakThresholdMs) {
        return evaluate(rules, DetectionContext.builder()
                .baseline(baseline)
                .compliance(compliance)
                .verdict(verdict)
                .leakThresholdMs(leakThresholdMs)
                .build());
    }

    /**
     * Evaluate the rules in dataset order.
     *
     * @param rules   rules loaded for the scan's jurisdiction
     * @param context captured sessions and verdict
     * @return violations, in rule order
     */
    @Observed(name = "rules.evaluate_all", contextualName = "evaluate-all-rules")
    public List<Violation> evaluate(List<Rule> rules, DetectionContext context) {
        List<Violation> violations = new ArrayList<>();

        for (Rule rule : rules) {
            if (rule.isDefinitional()) {
                log.debug("Rule {} is definitional, not evaluated", rule.getRuleId());
                continue;
            }
            if (rule.getDetectorKey() == null || rule.getDetectorKey().isBlank()) {
                continue;
            }
            RuleDetector detector = detectorMap.get(rule.getDetectorKey());
            if (detector == null) {
                log.warn("No detector registered for key: {}, rule: {}", rule.getDetectorKey(), rule.getRuleId());
                continue;
            }

            Span ruleSpan = tracer.nextSpan()
                    .name("rule.detect." + rule.getDetectorKey())
                    .tag("rule.id", rule.getRuleId())
                    .tag("rule.jurisdiction", String.valueOf(rule.getJurisdiction()))
                    .tag("rule.detector", rule.getDetectorKey())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                DetectorOutcome outcome = detector.detect(rule, context);
                ruleSpan.tag("rule.outcome", outcome.getStatus().name());

                switch (outcome.getStatus()) {
                    case TRIGGERED -> {
                        violations.add(outcome.getViolation());
                        metricsConfig.recordRuleTriggered(rule.getDetectorKey());
                        log.info("Rule triggered: {} ({}) severity={}", rule.getRuleId(),
                                rule.getDetectorKey(), outcome.getViolation().getSeverity());
                    }
                    case SKIPPED -> {
                        metricsConfig.recordDetectorSkipped(rule.getDetectorKey());
                        log.info("Rule {} skipped by {}: {}", rule.getRuleId(),
                                rule.getDetectorKey(), outcome.getReason());
                    }
                    case COMPLIANT -> log.debug("Rule {} compliant: {}", rule.getRuleId(), outcome.getReason());
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                log.error("Error evaluating rule {} with detector {}: {}",
                        rule.getRuleId(), rule.getDetectorKey(), e.getMessage(), e);
                // Don't let one bad rule block the entire evaluation
            } finally {
                ruleSpan.end();
            }
        }

        return violations;
    }
}
