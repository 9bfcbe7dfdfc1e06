package com.privacy.signalaudit.engine;

import com.privacy.signalaudit.config.MetricsConfig;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.Severity;
import com.privacy.signalaudit.model.Verdict;
import com.privacy.signalaudit.model.Violation;
import com.privacy.signalaudit.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RuleEngineTest {

    @Mock private RuleDetector signalDetector;
    @Mock private RuleDetector bannerDetector;
    @Mock private MetricsConfig metricsConfig;

    private RuleEngine engine;
    private DetectionContext context;

    @BeforeEach
    void setUp() {
        lenient().when(signalDetector.getDetectorKey()).thenReturn("signal_not_honored");
        lenient().when(bannerDetector.getDetectorKey()).thenReturn("missing_consent_banner");
        engine = new RuleEngine(List.of(signalDetector, bannerDetector), Tracer.NOOP, metricsConfig);

        SessionLog baseline = TestDataFactory.sessionWithTrackers("baseline", "doubleclick.net");
        SessionLog compliance = TestDataFactory.sessionWithTrackers("compliance", "doubleclick.net");
        context = DetectionContext.builder()
                .baseline(baseline)
                .compliance(compliance)
                .verdict(new VerdictEngine(new TemporalLeakDetector()).computeVerdict(baseline, compliance, 500))
                .leakThresholdMs(500)
                .build();
    }

    @Test
    void evaluate_triggeredDetector_producesViolationAndMetric() {
        Rule rule = TestDataFactory.rule("CCPA-1798.135b", "signal_not_honored");
        Violation violation = TestDataFactory.violation("CCPA-1798.135b", Severity.HIGH, "7500.00");
        when(signalDetector.detect(rule, context)).thenReturn(DetectorOutcome.triggered(violation));

        List<Violation> violations = engine.evaluate(List.of(rule), context);

        assertThat(violations).containsExactly(violation);
        verify(metricsConfig).recordRuleTriggered("signal_not_honored");
    }

    @Test
    void evaluate_definitionalRule_detectorNeverCalled() {
        Rule definitional = TestDataFactory.rule("CCPA-1798.140ah", "signal_not_honored", null, null);

        List<Violation> violations = engine.evaluate(List.of(definitional), context);

        assertThat(violations).isEmpty();
        verify(signalDetector, never()).detect(any(), any());
    }

    @Test
    void evaluate_rulesWithoutDetectorOrUnknownKey_areNotEvaluated() {
        Rule noKey = TestDataFactory.rule("CCPA-1798.105", null);
        Rule unknownKey = TestDataFactory.rule("CCPA-1798.999", "no_such_detector");

        assertThat(engine.evaluate(List.of(noKey, unknownKey), context)).isEmpty();
        verify(signalDetector, never()).detect(any(), any());
        verify(bannerDetector, never()).detect(any(), any());
    }

    @Test
    void evaluate_failingDetector_doesNotStopOtherRules() {
        Rule failing = TestDataFactory.rule("CCPA-1798.135b", "signal_not_honored");
        Rule banner = TestDataFactory.rule("CCPA-1798.130a5A", "missing_consent_banner");
        Violation bannerViolation = TestDataFactory.violation("CCPA-1798.130a5A", Severity.MEDIUM, "7500.00");
        when(signalDetector.detect(eq(failing), any())).thenThrow(new IllegalStateException("boom"));
        when(bannerDetector.detect(eq(banner), any())).thenReturn(DetectorOutcome.triggered(bannerViolation));

        List<Violation> violations = engine.evaluate(List.of(failing, banner), context);

        assertThat(violations).containsExactly(bannerViolation);
    }

    @Test
    void evaluate_skippedDetector_recordedAsSkippedNotViolation() {
        Rule rule = TestDataFactory.rule("CCPA-1798.135b", "signal_not_honored");
        when(signalDetector.detect(rule, context)).thenReturn(DetectorOutcome.skipped("insufficient data"));

        assertThat(engine.evaluate(List.of(rule), context)).isEmpty();
        verify(metricsConfig).recordDetectorSkipped("signal_not_honored");
        verify(metricsConfig, never()).recordRuleTriggered(any());
    }

    @Test
    void evaluate_preservesRuleOrder() {
        Rule banner = TestDataFactory.rule("CCPA-1798.130a5A", "missing_consent_banner");
        Rule signal = TestDataFactory.rule("CCPA-1798.135b", "signal_not_honored");
        Violation bannerViolation = TestDataFactory.violation("CCPA-1798.130a5A", Severity.MEDIUM, "7500.00");
        Violation signalViolation = TestDataFactory.violation("CCPA-1798.135b", Severity.HIGH, "7500.00");
        when(bannerDetector.detect(banner, context)).thenReturn(DetectorOutcome.triggered(bannerViolation));
        when(signalDetector.detect(signal, context)).thenReturn(DetectorOutcome.triggered(signalViolation));

        assertThat(engine.evaluate(List.of(banner, signal), context))
                .containsExactly(bannerViolation, signalViolation);
    }

    @Test
    void duplicateDetectorKeys_rejectedAtRegistration() {
        assertThatThrownBy(() -> new RuleEngine(List.of(signalDetector, signalDetector), Tracer.NOOP, metricsConfig))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void evaluate_convenienceOverloadBuildsContext() {
        Rule rule = TestDataFactory.rule("CCPA-1798.135b", "signal_not_honored");
        Verdict verdict = context.getVerdict();
        when(signalDetector.detect(eq(rule), any())).thenReturn(DetectorOutcome.compliant("nothing shared"));

        List<Violation> violations = engine.evaluate(List.of(rule), context.getBaseline(), context.getCompliance(),
                verdict, 500);

        assertThat(violations).isEmpty();
        verify(signalDetector).detect(eq(rule), eq(context));
    }
}
