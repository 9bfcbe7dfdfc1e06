package com.privacy.signalaudit.service;

import com.privacy.signalaudit.classification.RequestClassifier;
import com.privacy.signalaudit.config.MetricsConfig;
import com.privacy.signalaudit.config.ScanConfig;
import com.privacy.signalaudit.engine.RuleEngine;
import com.privacy.signalaudit.engine.VerdictEngine;
import com.privacy.signalaudit.model.EvidenceReport;
import com.privacy.signalaudit.model.EvidenceReport.ReportMetadata;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.ScanEvent;
import com.privacy.signalaudit.model.ScanParameters;
import com.privacy.signalaudit.model.ScanRequest;
import com.privacy.signalaudit.model.ScanResult;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.SignalConfig;
import com.privacy.signalaudit.model.Verdict;
import com.privacy.signalaudit.model.VerdictOutcome;
import com.privacy.signalaudit.model.Violation;
import com.privacy.signalaudit.repository.RuleRepository;
import com.privacy.signalaudit.service.enrichment.EnrichmentService;
import com.privacy.signalaudit.session.RecordingEventSink;
import com.privacy.signalaudit.session.SessionRunner;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Main orchestrator for a scan.
 *
 * Flow:
 * 1. Resolve the request into immutable scan parameters and load the rules (fail fast)
 * 2. Run the baseline and compliance sessions over the itinerary
 * 3. Compute the verdict from the two session logs
 * 4. Run every applicable rule detector
 * 5. Optionally enrich the violations
 * 6. Assemble the evidence report
 */
@Service
public class ScanService {

    private static final Logger log = LoggerFactory.getLogger(ScanService.class);

    private final RuleRepository ruleRepository;
    private final RequestClassifier classifier;
    private final SessionRunner sessionRunner;
    private final VerdictEngine verdictEngine;
    private final RuleEngine ruleEngine;
    private final EnrichmentService enrichmentService;
    private final EvidenceReportBuilder reportBuilder;
    private final ScanConfig scanConfig;
    private final MetricsConfig metricsConfig;

    public ScanService(RuleRepository ruleRepository,
                       RequestClassifier classifier,
                       SessionRunner sessionRunner,
                       VerdictEngine verdictEngine,
                       RuleEngine ruleEngine,
                       EnrichmentService enrichmentService,
                       EvidenceReportBuilder reportBuilder,
                       ScanConfig scanConfig,
                       MetricsConfig metricsConfig) {
        this.ruleRepository = ruleRepository;
        this.classifier = classifier;
        this.sessionRunner = sessionRunner;
        this.verdictEngine = verdictEngine;
        this.ruleEngine = ruleEngine;
        this.enrichmentService = enrichmentService;
        this.reportBuilder = reportBuilder;
        this.scanConfig = scanConfig;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "scan.run", contextualName = "run-scan")
    public ScanResult scan(ScanRequest request) {
        long started = System.nanoTime();

        // 1. Everything that can be wrong with the setup is reported before a browser starts
        ScanParameters parameters = resolveParameters(request);
        List<Rule> rules = loadRules(parameters);
        if (classifier.getTrackerDomains().isEmpty()) {
            throw new ScanConfigurationException("Tracker domain table is empty; check classification.tracker-domains");
        }

        RecordingEventSink events = new RecordingEventSink();
        events.info(ScanEvent.SYSTEM_SOURCE, String.format("Scan %s started: %s, %d pages, %d %s rules",
                parameters.getScanId(), parameters.getTarget(), parameters.getItinerary().size(),
                rules.size(), parameters.getJurisdiction()));

        // 2. Sessions
        Map<String, SessionLog> sessionLogs = sessionRunner.runSessions(
                parameters.getItinerary(), parameters.getSignalConfigs(),
                parameters.getPerPageTimeout(), parameters.getTotalTimeout(), events);
        SessionLog baseline = sessionLogs.get(parameters.getSignalConfigs().get(0).getLabel());
        SessionLog compliance = sessionLogs.get(parameters.getSignalConfigs().get(1).getLabel());

        List<String> warnings = new ArrayList<>();
        for (SessionLog sessionLog : sessionLogs.values()) {
            if (sessionLog.isAborted()) {
                warnings.add("Session " + sessionLog.getLabel() + " aborted: " + sessionLog.getAbortReason());
            }
            if (sessionLog.isTimedOut()) {
                warnings.add("Session " + sessionLog.getLabel() + " hit the total timeout; remaining pages were not visited");
            }
        }

        // 3. Verdict
        Verdict verdict = verdictEngine.computeVerdict(baseline, compliance, parameters.getLeakThresholdMs());
        if (verdict.getOutcome() == VerdictOutcome.INSUFFICIENT_DATA) {
            events.warning(ScanEvent.SYSTEM_SOURCE,
                    "Insufficient data: a session loaded no page, signal comparison not possible");
        }

        // 4. Rules
        List<Violation> violations = ruleEngine.evaluate(rules, baseline, compliance, verdict,
                parameters.getLeakThresholdMs());

        // 5. Enrichment
        if (parameters.isEnrichmentEnabled() && enrichmentService.isAvailable() && !violations.isEmpty()) {
            events.info(ScanEvent.SYSTEM_SOURCE, "Enriching " + violations.size() + " violations");
            violations = enrichmentService.enrich(violations, rules);
        }

        // 6. Report
        ReportMetadata metadata = ReportMetadata.builder()
                .tool(scanConfig.getToolName())
                .version(scanConfig.getToolVersion())
                .scanId(parameters.getScanId())
                .target(parameters.getTarget())
                .jurisdiction(parameters.getJurisdiction())
                .generatedAt(Instant.now())
                .elapsedSeconds(Math.round((System.nanoTime() - started) / 1e8) / 10.0)
                .leakThresholdMs(parameters.getLeakThresholdMs())
                .itinerarySize(parameters.getItinerary().size())
                .warnings(warnings)
                .build();
        EvidenceReport report = reportBuilder.build(metadata, sessionLogs, verdict, violations);

        metricsConfig.recordScan(verdict.getOutcome().name(), violations.size());
        events.success(ScanEvent.SYSTEM_SOURCE, String.format("Scan complete: %s, %d violations, max penalty $%s",
                report.getOutcome(), violations.size(),
                report.getViolationSummary().getMaxPotentialPenaltyUsd().toPlainString()));
        log.info("Scan {} of {} finished in {}s: verdict={}, outcome={}, violations={}",
                parameters.getScanId(), parameters.getTarget(), metadata.getElapsedSeconds(),
                verdict.getOutcome(), report.getOutcome(), violations.size());

        return ScanResult.builder()
                .report(report)
                .sessionLogs(sessionLogs)
                .events(events.getEvents())
                .build();
    }

    ScanParameters resolveParameters(ScanRequest request) {
        if (request == null || request.getItinerary() == null || request.getItinerary().isEmpty()) {
            throw new ScanConfigurationException("Itinerary is empty; nothing to scan");
        }
        long perPageMs = request.getPerPageTimeoutMs() != null
                ? request.getPerPageTimeoutMs() : scanConfig.getPerPageTimeoutMs();
        long totalMs = request.getTotalTimeoutMs() != null
                ? request.getTotalTimeoutMs() : scanConfig.getTotalTimeoutMs();
        long leakMs = request.getLeakThresholdMs() != null
                ? request.getLeakThresholdMs() : scanConfig.getLeakThresholdMs();
        if (perPageMs <= 0 || totalMs <= 0 || leakMs <= 0) {
            throw new ScanConfigurationException(String.format(
                    "Timeouts and leak threshold must be positive (perPage=%d, total=%d, leak=%d)",
                    perPageMs, totalMs, leakMs));
        }

        String jurisdiction = request.getJurisdiction() != null && !request.getJurisdiction().isBlank()
                ? request.getJurisdiction() : scanConfig.getDefaultJurisdiction();
        String target = request.getTarget() != null ? request.getTarget() : request.getItinerary().get(0);
        boolean enrichment = request.getEnrichmentEnabled() == null || request.getEnrichmentEnabled();

        return ScanParameters.builder()
                .scanId(UUID.randomUUID().toString())
                .target(target)
                .itinerary(request.getItinerary())
                .jurisdiction(jurisdiction.toUpperCase(Locale.ROOT))
                .perPageTimeout(Duration.ofMillis(perPageMs))
                .totalTimeout(Duration.ofMillis(totalMs))
                .leakThresholdMs(leakMs)
                .signalConfig(SignalConfig.baseline())
                .signalConfig(SignalConfig.compliance(scanConfig.getSignalHeaderName(),
                        scanConfig.getSignalHeaderValue(), scanConfig.getSignalScript()))
                .enrichmentEnabled(enrichment)
                .skipSupersededRules(scanConfig.isSkipSupersededRules())
                .build();
    }

    private List<Rule> loadRules(ScanParameters parameters) {
        List<Rule> all = ruleRepository.findByJurisdiction(parameters.getJurisdiction());
        if (all.isEmpty()) {
            throw new ScanConfigurationException("No rules loaded for jurisdiction " + parameters.getJurisdiction()
                    + " (available: " + ruleRepository.getJurisdictions() + ")");
        }
        return ruleRepository.findApplicable(parameters.getJurisdiction(), parameters.isSkipSupersededRules());
    }
}
