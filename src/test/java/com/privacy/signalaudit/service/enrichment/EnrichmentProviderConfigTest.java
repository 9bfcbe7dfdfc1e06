package com.privacy.signalaudit.service.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.privacy.signalaudit.config.EnrichmentConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EnrichmentProviderConfigTest {

    @Test
    void providersWithoutApiKey_areLeftOut() {
        EnrichmentConfig config = new EnrichmentConfig();
        EnrichmentConfig.Provider keyless = new EnrichmentConfig.Provider();
        keyless.setName("anthropic");
        keyless.setApiKey("");
        keyless.setModel("claude-3-5-sonnet-latest");
        EnrichmentConfig.Provider openai = new EnrichmentConfig.Provider();
        openai.setName("openai");
        openai.setApiKey("sk-test");
        openai.setModel("gpt-4o");
        config.setProviders(List.of(keyless, openai));

        List<EnrichmentProvider> providers = EnrichmentProviderConfig.providers(config, new ObjectMapper());

        assertThat(providers).extracting(EnrichmentProvider::getName).containsExactly("openai");

        config.setEnabled(false);
        assertThat(EnrichmentProviderConfig.providers(config, new ObjectMapper())).isEmpty();
    }
}
