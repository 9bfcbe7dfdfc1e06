package com.privacy.signalaudit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Selectors and link texts used to inspect a loaded page.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "inspection")
public class InspectionConfig {

    // Any visible match counts as a cookie/consent banner
    private List<String> bannerSelectors = new ArrayList<>(List.of(
            "[class*='cookie']", "[id*='cookie']",
            "[class*='consent']", "[id*='consent']",
            "[class*='gdpr']", "[id*='privacy-banner']",
            "div[aria-label*='cookie']"));

    // Lower-case fragments of "Do Not Sell or Share" style link texts
    private List<String> optOutLinkTexts = new ArrayList<>(List.of(
            "do not sell", "do not share", "your privacy choices", "california privacy",
            "opt-out", "opt out", "limit the use", "your ad choices"));

    // Button texts tried first, in order
    private List<String> rejectButtonTexts = new ArrayList<>(List.of(
            "reject all", "decline all", "reject", "decline", "necessary only",
            "only essential", "decline cookies", "no thanks", "save settings"));

    // Fallback selectors when no button text matched
    private List<String> rejectSelectors = new ArrayList<>(List.of(
            "#reject-all", ".reject-all", "#cookie-reject", ".cookie-reject-all", "[id*='reject-all']"));
}
