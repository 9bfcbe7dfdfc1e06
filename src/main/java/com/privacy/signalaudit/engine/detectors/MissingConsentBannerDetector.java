package com.privacy.signalaudit.engine.detectors;

import com.privacy.signalaudit.engine.DetectionContext;
import com.privacy.signalaudit.engine.DetectorOutcome;
import com.privacy.signalaudit.engine.RuleDetector;
import com.privacy.signalaudit.model.PageVisit;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.Severity;
import com.privacy.signalaudit.model.Violation;
import com.privacy.signalaudit.model.ViolationType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pages loaded without any cookie or consent notice, in either session.
 * Banner inspection happens before any reject click, so a page of the
 * compliance session is judged on what the visitor first saw.
 */
@Component
public class MissingConsentBannerDetector implements RuleDetector {

    public static final String KEY = "missing_consent_banner";

    private static final int SAMPLE_SIZE = 10;

    @Override
    public String getDetectorKey() {
        return KEY;
    }

    @Override
    public DetectorOutcome detect(Rule rule, DetectionContext context) {
        List<SessionLog> sessions = List.of(context.getBaseline(), context.getCompliance());
        int checked = 0;
        List<Map<String, Object>> withoutBanner = new ArrayList<>();
        Set<String> affectedUrls = new LinkedHashSet<>();
        for (SessionLog session : sessions) {
            for (PageVisit visit : session.getLoadedPages()) {
                checked++;
                if (!visit.isCookieBannerPresent()) {
                    Map<String, Object> page = new LinkedHashMap<>();
                    page.put("session", session.getLabel());
                    page.put("url", visit.getUrl());
                    withoutBanner.add(page);
                    affectedUrls.add(visit.getUrl());
                }
            }
        }
        if (checked == 0) {
            return DetectorOutcome.skipped("no page loaded in either session");
        }
        if (withoutBanner.isEmpty()) {
            return DetectorOutcome.compliant("consent banner shown on all " + checked + " loaded pages");
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("affectedPageCount", withoutBanner.size());
        evidence.put("affectedUrls", EvidenceSamples.first(List.copyOf(affectedUrls), SAMPLE_SIZE));
        evidence.put("pagesWithoutBanner", EvidenceSamples.first(withoutBanner, SAMPLE_SIZE));
        evidence.put("totalPagesChecked", checked);

        return DetectorOutcome.triggered(Violation.forRule(rule)
                .violationType(ViolationType.MISSING_CONSENT_BANNER)
                .severity(Severity.MEDIUM)
                .evidence(evidence)
                .recommendation("Show a cookie and privacy notice on every page before any "
                        + "non-essential tracking script loads.")
                .build());
    }
}
