package com.privacy.signalaudit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jayway.jsonpath.JsonPath;
import com.privacy.signalaudit.model.EvidenceReport;
import com.privacy.signalaudit.model.ScanResult;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.Severity;
import com.privacy.signalaudit.model.Verdict;
import com.privacy.signalaudit.model.VerdictOutcome;
import com.privacy.signalaudit.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReportWriterTest {

    @TempDir
    Path outputDir;

    private ReportWriter writer;
    private ScanResult result;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        writer = new ReportWriter(mapper);

        Map<String, SessionLog> logs = new LinkedHashMap<>();
        logs.put("baseline", TestDataFactory.sessionWithTrackers("baseline", "doubleclick.net"));
        logs.put("compliance", TestDataFactory.sessionWithTrackers("compliance", "doubleclick.net"));
        Verdict verdict = Verdict.builder()
                .outcome(VerdictOutcome.NON_COMPLIANT)
                .domainsIgnoringSignal(Set.of("doubleclick.net"))
                .build();
        EvidenceReport report = new EvidenceReportBuilder().build(
                EvidenceReport.ReportMetadata.builder()
                        .tool("signal-audit")
                        .scanId("scan-1")
                        .target("https://shop.example.com")
                        .jurisdiction("CCPA")
                        .generatedAt(Instant.parse("2025-03-01T12:00:00Z"))
                        .build(),
                logs, verdict,
                List.of(TestDataFactory.violation("CCPA-1798.135b", Severity.HIGH, "7500.00")));
        result = ScanResult.builder().report(report).sessionLogs(logs).events(List.of()).build();
    }

    @Test
    void write_reportAndTrafficExports() throws IOException {
        List<Path> files = writer.write(result, outputDir, true);

        assertThat(files).extracting(path -> path.getFileName().toString())
                .containsExactly("evidence_report.json", "traffic_baseline.json", "traffic_compliance.json");

        String json = Files.readString(outputDir.resolve(ReportWriter.REPORT_FILE));
        assertThat(JsonPath.<String>read(json, "$.reportMetadata.generatedAt")).isEqualTo("2025-03-01T12:00:00Z");
        assertThat(JsonPath.<String>read(json, "$.verdict.outcome")).isEqualTo("NON_COMPLIANT");
        assertThat(JsonPath.<List<String>>read(json, "$.verdict.domainsIgnoringSignal")).containsExactly("doubleclick.net");
        assertThat(JsonPath.<String>read(json, "$.outcome")).isEqualTo("VIOLATIONS_FOUND");
        assertThat(JsonPath.<Integer>read(json, "$.violationSummary.severityBreakdown.HIGH")).isEqualTo(1);
        assertThat(JsonPath.<List<String>>read(json, "$.sessionSummary.baseline.trackerDomains"))
                .containsExactly("doubleclick.net");

        String traffic = Files.readString(outputDir.resolve("traffic_compliance.json"));
        assertThat(JsonPath.<String>read(traffic, "$.label")).isEqualTo("compliance");
        assertThat(JsonPath.<List<Object>>read(traffic, "$.requests")).hasSize(1);
    }

    @Test
    void write_withoutExport_onlyWritesReport() throws IOException {
        List<Path> files = writer.write(result, outputDir.resolve("nested/dir"), false);

        assertThat(files).hasSize(1);
        assertThat(Files.exists(outputDir.resolve("nested/dir/evidence_report.json"))).isTrue();
        assertThat(Files.exists(outputDir.resolve("nested/dir/traffic_baseline.json"))).isFalse();
    }

    @Test
    void trafficFileName_sanitizesLabel() {
        assertThat(ReportWriter.trafficFileName("compliance")).isEqualTo("traffic_compliance.json");
        assertThat(ReportWriter.trafficFileName("gpc/v2 run")).isEqualTo("traffic_gpc_v2_run.json");
    }
}
