package com.privacy.signalaudit.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.privacy.signalaudit.model.ScanResult;
import com.privacy.signalaudit.model.SessionLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Persists the evidence report and, optionally, the raw session logs as JSON.
 */
@Component
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    static final String REPORT_FILE = "evidence_report.json";

    private final ObjectWriter writer;

    public ReportWriter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    /**
     * @return the files written, report first, then one traffic export per session in session order
     */
    public List<Path> write(ScanResult result, Path outputDir, boolean exportSessionLogs) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();

        Path reportFile = outputDir.resolve(REPORT_FILE);
        writer.writeValue(reportFile.toFile(), result.getReport());
        written.add(reportFile);

        if (exportSessionLogs) {
            for (Map.Entry<String, SessionLog> entry : result.getSessionLogs().entrySet()) {
                Path trafficFile = outputDir.resolve(trafficFileName(entry.getKey()));
                writer.writeValue(trafficFile.toFile(), entry.getValue());
                written.add(trafficFile);
            }
        }

        log.info("Wrote {} report files to {}", written.size(), outputDir.toAbsolutePath());
        return written;
    }

    static String trafficFileName(String label) {
        return "traffic_" + label.replaceAll("[^A-Za-z0-9_-]", "_") + ".json";
    }
}
