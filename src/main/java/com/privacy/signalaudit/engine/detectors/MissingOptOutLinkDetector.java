package com.privacy.signalaudit.engine.detectors;

import com.privacy.signalaudit.engine.DetectionContext;
import com.privacy.signalaudit.engine.DetectorOutcome;
import com.privacy.signalaudit.engine.RuleDetector;
import com.privacy.signalaudit.model.PageVisit;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.Severity;
import com.privacy.signalaudit.model.Violation;
import com.privacy.signalaudit.model.ViolationType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Every page loaded in the compliance session must offer a "Do Not Sell or Share" style link.
 */
@Component
public class MissingOptOutLinkDetector implements RuleDetector {

    public static final String KEY = "missing_opt_out_link";

    private static final int SAMPLE_SIZE = 10;

    @Override
    public String getDetectorKey() {
        return KEY;
    }

    @Override
    public DetectorOutcome detect(Rule rule, DetectionContext context) {
        List<PageVisit> loaded = context.getCompliance().getLoadedPages();
        if (loaded.isEmpty()) {
            return DetectorOutcome.skipped("no page loaded in the compliance session");
        }

        Set<String> checked = new LinkedHashSet<>();
        Set<String> missing = new LinkedHashSet<>();
        for (PageVisit visit : loaded) {
            checked.add(visit.getUrl());
            if (!visit.isOptOutLinkPresent()) {
                missing.add(visit.getUrl());
            }
        }
        if (missing.isEmpty()) {
            return DetectorOutcome.compliant("opt-out link found on all " + checked.size() + " pages");
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("affectedPageCount", missing.size());
        evidence.put("pagesMissingLink", EvidenceSamples.first(List.copyOf(missing), SAMPLE_SIZE));
        evidence.put("totalPagesChecked", checked.size());
        evidence.put("pagesCompliant", checked.size() - missing.size());

        return DetectorOutcome.triggered(Violation.forRule(rule)
                .violationType(ViolationType.MISSING_OPT_OUT_LINK)
                .severity(Severity.HIGH)
                .evidence(evidence)
                .recommendation("Add a clear and conspicuous 'Do Not Sell or Share My Personal Information' "
                        + "or 'Your Privacy Choices' link to every page.")
                .build());
    }
}
