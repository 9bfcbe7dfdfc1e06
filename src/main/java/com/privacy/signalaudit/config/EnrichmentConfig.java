package com.privacy.signalaudit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "enrichment")
public class EnrichmentConfig {

    private boolean enabled = true;

    // Tried in order; a provider without an api key is not created
    private List<Provider> providers = new ArrayList<>();

    @Data
    public static class Provider {
        private String name;
        // OpenAI-compatible chat completions endpoint
        private String baseUrl;
        private String apiKey;
        private String model;
        private double temperature = 0.2;
        private int maxTokens = 600;
        private int timeoutSeconds = 30;
    }
}
