package com.privacy.signalaudit.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.privacy.signalaudit.model.Enrichment;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.Violation;
import dev.langchain4j.model.chat.ChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Enrichment backed by a langchain4j chat model. The model is asked for a
 * single JSON object with {@code plainEnglish} and {@code technicalFix}.
 */
public class ChatModelEnrichmentProvider implements EnrichmentProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatModelEnrichmentProvider.class);

    private static final int EVIDENCE_LIMIT = 400;
    private static final int RULE_TEXT_LIMIT = 800;

    private final String name;
    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;

    public ChatModelEnrichmentProvider(String name, ChatModel chatModel, ObjectMapper objectMapper) {
        this.name = name;
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Optional<Enrichment> enrich(Violation violation, Rule rule) {
        String answer = chatModel.chat(buildPrompt(violation, rule));
        return parse(answer);
    }

    String buildPrompt(Violation violation, Rule rule) {
        String ruleText = rule != null && rule.getRuleText() != null ? truncate(rule.getRuleText(), RULE_TEXT_LIMIT) : "";
        return "You are a privacy compliance attorney. A website audit found the violation below.\n"
                + "Provide:\n"
                + "1. plainEnglish: a plain-English explanation in two sentences, no legal jargon\n"
                + "2. technicalFix: one specific technical fix the engineering team should implement\n\n"
                + "Rule: " + violation.getRuleId() + " " + violation.getSectionCitation() + " - " + violation.getRuleTitle() + "\n"
                + "Rule text: " + ruleText + "\n"
                + "Violation type: " + violation.getViolationType() + "\n"
                + "Severity: " + violation.getSeverity() + "\n"
                + "Evidence: " + truncate(String.valueOf(violation.getEvidence()), EVIDENCE_LIMIT) + "\n\n"
                + "Respond with valid JSON only: {\"plainEnglish\": \"...\", \"technicalFix\": \"...\"}";
    }

    Optional<Enrichment> parse(String answer) {
        if (answer == null) {
            return Optional.empty();
        }
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            log.warn("Enrichment provider {} returned no JSON object", name);
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(answer.substring(start, end + 1));
            String plainEnglish = text(node, "plainEnglish", "plain_english");
            String technicalFix = text(node, "technicalFix", "technical_fix");
            if (plainEnglish == null && technicalFix == null) {
                log.warn("Enrichment provider {} answered without plainEnglish or technicalFix", name);
                return Optional.empty();
            }
            return Optional.of(Enrichment.builder()
                    .plainEnglish(plainEnglish)
                    .technicalFix(technicalFix)
                    .build());
        } catch (JsonProcessingException e) {
            log.warn("Enrichment provider {} returned invalid JSON: {}", name, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    private static String truncate(String value, int limit) {
        return value.length() <= limit ? value : value.substring(0, limit);
    }
}
