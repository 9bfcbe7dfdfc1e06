package com.privacy.signalaudit.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordScan(String verdict, int violationCount) {
        Counter.builder("scan.count")
                .tag("verdict", verdict)
                .register(registry)
                .increment();

        DistributionSummary.builder("scan.violations")
                .tag("verdict", verdict)
                .register(registry)
                .record(violationCount);
    }

    public void recordPageVisit(String session, String status) {
        Counter.builder("page.visit.count")
                .tag("session", session)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordRuleTriggered(String detectorKey) {
        Counter.builder("rule.triggered.count")
                .tag("detector", detectorKey)
                .register(registry)
                .increment();
    }

    public void recordDetectorSkipped(String detectorKey) {
        Counter.builder("detector.skipped.count")
                .tag("detector", detectorKey)
                .register(registry)
                .increment();
    }

    public void recordEnrichment(String provider, String status) {
        Counter.builder("enrichment.call.count")
                .tag("provider", provider)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
