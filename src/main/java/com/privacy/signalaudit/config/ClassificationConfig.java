package com.privacy.signalaudit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tracker domains and PII patterns used to classify captured requests.
 * Values here are defaults; application.yml may replace either table.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "classification")
public class ClassificationConfig {

    // A host matches when it equals an entry or is a subdomain of one
    private List<String> trackerDomains = new ArrayList<>(List.of(
            "google-analytics.com", "analytics.google.com", "googletagmanager.com",
            "segment.com", "segment.io", "mixpanel.com", "amplitude.com", "heap.io",
            "hotjar.com", "fullstory.com", "clarity.ms",
            "connect.facebook.net", "facebook.com",
            "doubleclick.net", "googlesyndication.com", "adservice.google.com",
            "advertising.com", "adsystem.amazon.com", "amazon-adsystem.com",
            "criteo.com", "taboola.com", "outbrain.com", "quantserve.com",
            "scorecardresearch.com", "bluekai.com", "krxd.net", "demdex.net",
            "rlcdn.com", "rubiconproject.com", "pubmatic.com", "openx.net",
            "bing.com", "bat.bing.com", "yandex.ru", "mc.yandex.ru",
            "linkedin.com", "px.ads.linkedin.com", "snap.licdn.com",
            "twitter.com", "analytics.twitter.com", "tiktok.com", "analytics.tiktok.com"));

    // Pattern name -> regex, matched case-insensitively against the full URL
    private Map<String, String> piiPatterns = defaultPiiPatterns();

    private static Map<String, String> defaultPiiPatterns() {
        Map<String, String> patterns = new LinkedHashMap<>();
        patterns.put("email", "[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
        patterns.put("encoded_email", "[a-zA-Z0-9._+-]+%40[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
        patterns.put("uid_param", "[?&]uid=[^&]+");
        patterns.put("user_id_param", "[?&]user_id=[^&]+");
        patterns.put("email_param", "[?&]email=[^&]+");
        patterns.put("phone_param", "[?&]phone=[^&]+");
        patterns.put("name_param", "[?&](first_name|last_name|fullname)=[^&]+");
        patterns.put("sha256_param", "sha256=[a-f0-9]{64}");
        patterns.put("hashed_id", "(?<![a-f0-9])([a-f0-9]{64}|[a-f0-9]{40}|[a-f0-9]{32})(?![a-f0-9])");
        patterns.put("ipv4", "\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b");
        return patterns;
    }
}
