package com.privacy.signalaudit.contract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.privacy.signalaudit.config.TestBrowserConfig;
import com.privacy.signalaudit.model.ConsentAction;
import com.privacy.signalaudit.model.ScanRequest;
import com.privacy.signalaudit.model.ScanResult;
import com.privacy.signalaudit.repository.RuleRepository;
import com.privacy.signalaudit.service.ReportWriter;
import com.privacy.signalaudit.service.ScanService;
import com.privacy.signalaudit.testutil.FakeBrowserEngine;
import com.privacy.signalaudit.testutil.FakeBrowserEngine.PageScript;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end scan through the real Spring context with a scripted browser.
 * Guards the evidence report layout consumers read.
 */
@SpringBootTest
@Import(TestBrowserConfig.class)
@ActiveProfiles("test")
class SignalAuditApplicationTest {

    private static final String HOME = "https://shop.example.com/";
    private static final String CART = "https://shop.example.com/cart";

    @Autowired private ScanService scanService;
    @Autowired private ReportWriter reportWriter;
    @Autowired private RuleRepository ruleRepository;
    @Autowired private FakeBrowserEngine browser;
    @Autowired private ObjectMapper objectMapper;

    @TempDir
    Path outputDir;

    @Test
    void bundledRulesAreLoaded() {
        assertThat(ruleRepository.getJurisdictions()).contains("CCPA", "GDPR");
    }

    @Test
    void scan_siteIgnoringTheSignal_producesEvidenceReport() throws Exception {
        browser.page("baseline", HOME, PageScript.loaded()
                        .request(50, "https://shop.example.com/app.js")
                        .request(1_000, "https://stats.g.doubleclick.net/collect?v=2&uid=8842")
                        .request(1_200, "https://connect.facebook.net/en_US/fbevents.js"))
                .page("compliance", HOME, PageScript.loaded()
                        .noOptOutLink()
                        .consent(ConsentAction.REJECTED)
                        .request(120, "https://stats.g.doubleclick.net/collect?v=2")
                        .request(3_000, "https://shop.example.com/api/cart"))
                .page(CART, PageScript.loaded());

        ScanResult result = scanService.scan(ScanRequest.builder()
                .target("https://shop.example.com")
                .url(HOME)
                .url(CART)
                .jurisdiction("CCPA")
                .build());

        assertThat(browser.getVisited()).contains("baseline:" + HOME, "baseline:" + CART,
                "compliance:" + HOME, "compliance:" + CART);

        DocumentContext json = JsonPath.parse(objectMapper.writeValueAsString(result.getReport()));
        assertThat(json.read("$.verdict.outcome", String.class)).isEqualTo("NON_COMPLIANT");
        assertThat(json.read("$.verdict.domainsIgnoringSignal", List.class)).containsExactly("stats.g.doubleclick.net");
        assertThat(json.read("$.verdict.leakCount", Integer.class)).isEqualTo(1);
        assertThat(json.read("$.outcome", String.class)).isEqualTo("VIOLATIONS_FOUND");
        assertThat(json.read("$.reportMetadata.jurisdiction", String.class)).isEqualTo("CCPA");
        assertThat(json.read("$.reportMetadata.itinerarySize", Integer.class)).isEqualTo(2);
        assertThat(json.read("$.sessionSummary.baseline.pagesLoaded", Integer.class)).isEqualTo(2);
        assertThat(json.read("$.sessionSummary.baseline.trackerDomains", List.class))
                .containsExactly("connect.facebook.net", "stats.g.doubleclick.net");
        assertThat(json.read("$.sessionSummary.compliance.trackerRequests", Integer.class)).isEqualTo(1);

        List<String> ruleIds = json.read("$.violations[*].ruleId");
        assertThat(ruleIds).contains("CCPA-1798.135b", "CCPA-1798.135b2", "CCPA-1798.135a", "CCPA-1798.100");
        assertThat(ruleIds).doesNotContain("CCPA-1798.140ah", "CCPA-1798.130a5A");

        List<Map<String, Object>> signal = json.read("$.violations[?(@.ruleId == 'CCPA-1798.135b')]");
        assertThat(signal).singleElement().satisfies(v -> {
            assertThat(v).containsEntry("severity", "HIGH").containsEntry("violationType", "SIGNAL_NOT_HONORED");
            assertThat(v).doesNotContainKey("plainEnglish");
        });
        assertThat(json.read("$.violationSummary.total", Integer.class)).isEqualTo(ruleIds.size());

        List<Path> files = reportWriter.write(result, outputDir, false);
        assertThat(files).singleElement().satisfies(file -> assertThat(Files.size(file)).isPositive());
    }
}
