package com.privacy.signalaudit.service.enrichment;

import com.privacy.signalaudit.config.MetricsConfig;
import com.privacy.signalaudit.model.Enrichment;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Annotates violations with explanations from the first provider that answers.
 * Never fails: a violation no provider could explain is returned unchanged.
 */
public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final List<EnrichmentProvider> providers;
    private final MetricsConfig metricsConfig;

    public EnrichmentService(List<EnrichmentProvider> providers, MetricsConfig metricsConfig) {
        this.providers = List.copyOf(providers);
        this.metricsConfig = metricsConfig;
        if (this.providers.isEmpty()) {
            log.info("Violation enrichment has no configured providers; reports will carry no explanations");
        } else {
            log.info("Violation enrichment providers (in order): {}",
                    this.providers.stream().map(EnrichmentProvider::getName).toList());
        }
    }

    public boolean isAvailable() {
        return !providers.isEmpty();
    }

    public List<Violation> enrich(List<Violation> violations, List<Rule> rules) {
        if (providers.isEmpty() || violations.isEmpty()) {
            return violations;
        }
        Map<String, Rule> rulesById = rules.stream()
                .collect(Collectors.toMap(Rule::getRuleId, Function.identity(), (a, b) -> a));

        List<Violation> enriched = new ArrayList<>(violations.size());
        for (Violation violation : violations) {
            enriched.add(enrich(violation, rulesById.get(violation.getRuleId())));
        }
        return enriched;
    }

    Violation enrich(Violation violation, Rule rule) {
        for (EnrichmentProvider provider : providers) {
            try {
                Optional<Enrichment> result = provider.enrich(violation, rule);
                if (result.isPresent()) {
                    metricsConfig.recordEnrichment(provider.getName(), "success");
                    log.debug("Violation {} enriched by {}", violation.getRuleId(), provider.getName());
                    return violation.toBuilder()
                            .plainEnglish(result.get().getPlainEnglish())
                            .technicalFix(result.get().getTechnicalFix())
                            .build();
                }
                metricsConfig.recordEnrichment(provider.getName(), "empty");
            } catch (Exception e) {
                metricsConfig.recordEnrichment(provider.getName(), "error");
                log.warn("Enrichment provider {} failed for violation {}: {}",
                        provider.getName(), violation.getRuleId(), e.getMessage());
            }
        }
        log.warn("No enrichment provider could explain violation {}; emitted without explanations",
                violation.getRuleId());
        return violation;
    }
}
