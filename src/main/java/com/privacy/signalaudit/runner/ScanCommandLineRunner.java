package com.privacy.signalaudit.runner;

import com.privacy.signalaudit.config.ScanConfig;
import com.privacy.signalaudit.model.EvidenceReport;
import com.privacy.signalaudit.model.ScanRequest;
import com.privacy.signalaudit.model.ScanResult;
import com.privacy.signalaudit.model.Violation;
import com.privacy.signalaudit.service.ReportWriter;
import com.privacy.signalaudit.service.ScanConfigurationException;
import com.privacy.signalaudit.service.ScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Runs one scan when the application is started with {@code --itinerary=url1,url2,...}.
 * Optional: {@code --jurisdiction}, {@code --target}, {@code --output-dir}.
 * Without an itinerary the runner does nothing.
 */
@Component
public class ScanCommandLineRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ScanCommandLineRunner.class);

    static final String ITINERARY = "itinerary";
    static final String JURISDICTION = "jurisdiction";
    static final String TARGET = "target";
    static final String OUTPUT_DIR = "output-dir";

    private final ScanService scanService;
    private final ReportWriter reportWriter;
    private final ScanConfig scanConfig;

    public ScanCommandLineRunner(ScanService scanService, ReportWriter reportWriter, ScanConfig scanConfig) {
        this.scanService = scanService;
        this.reportWriter = reportWriter;
        this.scanConfig = scanConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> itinerary = parseItinerary(args);
        if (itinerary.isEmpty()) {
            log.info("No --{} given; nothing to scan", ITINERARY);
            return;
        }

        ScanRequest request = ScanRequest.builder()
                .itinerary(itinerary)
                .jurisdiction(single(args, JURISDICTION))
                .target(single(args, TARGET))
                .build();
        String outputDir = single(args, OUTPUT_DIR);
        Path output = Path.of(outputDir != null ? outputDir : scanConfig.getOutputDir());

        ScanResult result;
        try {
            result = scanService.scan(request);
        } catch (ScanConfigurationException e) {
            log.error("Scan not started: {}", e.getMessage());
            throw e;
        }

        try {
            reportWriter.write(result, output, scanConfig.isExportSessionLogs());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write report to " + output, e);
        }
        printSummary(result.getReport());
    }

    static List<String> parseItinerary(ApplicationArguments args) {
        List<String> values = args.getOptionValues(ITINERARY);
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(url -> !url.isEmpty())
                .toList();
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private void printSummary(EvidenceReport report) {
        log.info("Outcome: {} | verdict: {} | violations: {} | max potential penalty: ${}",
                report.getOutcome(), report.getVerdict().getOutcome(),
                report.getViolationSummary().getTotal(),
                report.getViolationSummary().getMaxPotentialPenaltyUsd().toPlainString());
        for (Violation violation : report.getViolations()) {
            log.info("  [{}] {} {} - {}", violation.getSeverity(), violation.getRuleId(),
                    violation.getViolationType(), violation.getRuleTitle());
        }
    }
}
