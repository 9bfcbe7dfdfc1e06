package com.privacy.signalaudit.service;

import com.privacy.signalaudit.model.EvidenceReport;
import com.privacy.signalaudit.model.EvidenceReport.ReportMetadata;
import com.privacy.signalaudit.model.EvidenceReport.SessionSummary;
import com.privacy.signalaudit.model.EvidenceReport.ViolationSummary;
import com.privacy.signalaudit.model.ReportOutcome;
import com.privacy.signalaudit.model.SessionLog;
import com.privacy.signalaudit.model.Severity;
import com.privacy.signalaudit.model.Verdict;
import com.privacy.signalaudit.model.VerdictOutcome;
import com.privacy.signalaudit.model.Violation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the evidence report from already computed results. No I/O.
 */
@Component
public class EvidenceReportBuilder {

    public EvidenceReport build(ReportMetadata metadata, Map<String, SessionLog> sessionLogs,
                                Verdict verdict, List<Violation> violations) {
        Map<String, SessionSummary> summaries = new LinkedHashMap<>();
        for (Map.Entry<String, SessionLog> entry : sessionLogs.entrySet()) {
            summaries.put(entry.getKey(), summarize(entry.getValue()));
        }

        return EvidenceReport.builder()
                .reportMetadata(metadata)
                .sessionSummary(summaries)
                .verdict(verdict)
                .violations(violations)
                .violationSummary(summarize(violations))
                .outcome(outcome(verdict, violations))
                .build();
    }

    SessionSummary summarize(SessionLog sessionLog) {
        return SessionSummary.builder()
                .pagesVisited(sessionLog.getPageVisits().size())
                .pagesLoaded(sessionLog.getSuccessfulPageCount())
                .totalRequests(sessionLog.getRequests().size())
                .trackerRequests(sessionLog.getTrackerRequestCount())
                .trackerDomains(sessionLog.getTrackerDomains())
                .timedOut(sessionLog.isTimedOut())
                .aborted(sessionLog.isAborted())
                .build();
    }

    ViolationSummary summarize(List<Violation> violations) {
        Map<Severity, Integer> breakdown = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            breakdown.put(severity, 0);
        }
        BigDecimal maxPenalty = BigDecimal.ZERO;
        for (Violation violation : violations) {
            breakdown.merge(violation.getSeverity(), 1, Integer::sum);
            if (violation.getPenaltyMax() != null) {
                maxPenalty = maxPenalty.add(violation.getPenaltyMax());
            }
        }
        return ViolationSummary.builder()
                .total(violations.size())
                .severityBreakdown(breakdown)
                .maxPotentialPenaltyUsd(maxPenalty)
                .build();
    }

    // Findings that do not need a comparable pair of sessions still count when the verdict is insufficient
    static ReportOutcome outcome(Verdict verdict, List<Violation> violations) {
        if (!violations.isEmpty()) {
            return ReportOutcome.VIOLATIONS_FOUND;
        }
        if (verdict.getOutcome() == VerdictOutcome.INSUFFICIENT_DATA) {
            return ReportOutcome.INSUFFICIENT_DATA;
        }
        return ReportOutcome.NO_VIOLATIONS;
    }
}
