package com.privacy.signalaudit.classification;

import com.privacy.signalaudit.config.ClassificationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Named regular expressions that indicate personal data in a request URL.
 * Patterns are compiled once, case-insensitively.
 */
@Component
public class PiiPatternTable {

    private static final Logger log = LoggerFactory.getLogger(PiiPatternTable.class);

    private final Map<String, Pattern> patterns;

    @Autowired
    public PiiPatternTable(ClassificationConfig config) {
        this(config.getPiiPatterns());
        log.info("Loaded {} PII patterns: {}", patterns.size(), patterns.keySet());
    }

    public PiiPatternTable(Map<String, String> definitions) {
        Map<String, Pattern> compiled = new LinkedHashMap<>();
        if (definitions != null) {
            for (Map.Entry<String, String> entry : definitions.entrySet()) {
                try {
                    compiled.put(entry.getKey(), Pattern.compile(entry.getValue(), Pattern.CASE_INSENSITIVE));
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException(
                            "Invalid PII pattern '" + entry.getKey() + "': " + e.getDescription(), e);
                }
            }
        }
        this.patterns = Collections.unmodifiableMap(compiled);
    }

    /**
     * Names of all patterns found in the text, in table order. Empty when none match.
     */
    public List<String> match(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> hits = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : patterns.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                hits.add(entry.getKey());
            }
        }
        return hits;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    public int size() {
        return patterns.size();
    }
}
