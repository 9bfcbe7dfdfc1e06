package com.privacy.signalaudit.service.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.privacy.signalaudit.config.EnrichmentConfig;
import com.privacy.signalaudit.config.MetricsConfig;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the enrichment service and its ordered providers from
 * {@code enrichment.providers}. Providers without an api key are left out.
 */
@Configuration
public class EnrichmentProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentProviderConfig.class);

    @Bean
    public EnrichmentService enrichmentService(EnrichmentConfig config, ObjectMapper objectMapper,
                                               MetricsConfig metricsConfig) {
        return new EnrichmentService(providers(config, objectMapper), metricsConfig);
    }

    static List<EnrichmentProvider> providers(EnrichmentConfig config, ObjectMapper objectMapper) {
        List<EnrichmentProvider> providers = new ArrayList<>();
        if (!config.isEnabled()) {
            log.info("Violation enrichment disabled");
            return providers;
        }
        for (EnrichmentConfig.Provider provider : config.getProviders()) {
            if (provider.getApiKey() == null || provider.getApiKey().isBlank()) {
                log.info("Enrichment provider {} has no api key, skipped", provider.getName());
                continue;
            }
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder()
                    .apiKey(provider.getApiKey())
                    .modelName(provider.getModel())
                    .temperature(provider.getTemperature())
                    .maxTokens(provider.getMaxTokens())
                    .timeout(Duration.ofSeconds(provider.getTimeoutSeconds()));
            if (provider.getBaseUrl() != null && !provider.getBaseUrl().isBlank()) {
                builder.baseUrl(provider.getBaseUrl());
            }
            providers.add(new ChatModelEnrichmentProvider(provider.getName(), builder.build(), objectMapper));
        }
        return providers;
    }
}
