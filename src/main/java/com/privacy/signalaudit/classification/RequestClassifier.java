package com.privacy.signalaudit.classification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;
import java.util.Locale;

/**
 * Classifies an outbound request URL as tracker and/or PII-bearing.
 * Stateless and safe to share between sessions.
 *
 * <p>URLs come straight from the browser, so characters such as {@code |},
 * {@code {}} or {@code ^} may appear unescaped in the query. Parsing is
 * lenient: only a URL with no recoverable scheme or host is a failure.
 */
@Component
public class RequestClassifier {

    private static final Logger log = LoggerFactory.getLogger(RequestClassifier.class);

    private final TrackerDomainTable trackerDomains;
    private final PiiPatternTable piiPatterns;

    public RequestClassifier(TrackerDomainTable trackerDomains, PiiPatternTable piiPatterns) {
        this.trackerDomains = trackerDomains;
        this.piiPatterns = piiPatterns;
    }

    public RequestClassification classify(String url) {
        if (url == null || url.isBlank()) {
            log.warn("Cannot classify request with empty URL");
            return RequestClassification.failed("empty URL");
        }

        UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(url).build();
        } catch (IllegalArgumentException e) {
            log.warn("Cannot classify malformed request URL {}: {}", abbreviate(url), e.getMessage());
            return RequestClassification.failed("malformed URL: " + e.getMessage());
        }
        if (uri.getScheme() == null) {
            log.warn("Cannot classify request URL without scheme: {}", abbreviate(url));
            return RequestClassification.failed("missing scheme");
        }
        String host = uri.getHost();
        if ((host == null || host.isEmpty()) && isNetworkScheme(uri.getScheme())) {
            log.warn("Cannot classify request URL without host: {}", abbreviate(url));
            return RequestClassification.failed("missing host");
        }

        String domain = host == null ? "" : host.toLowerCase(Locale.ROOT);
        List<String> piiTypes = piiPatterns.match(url);

        return RequestClassification.builder()
                .domain(domain)
                .tracker(trackerDomains.matches(domain))
                .containsPii(!piiTypes.isEmpty())
                .piiTypes(piiTypes)
                .build();
    }

    public TrackerDomainTable getTrackerDomains() {
        return trackerDomains;
    }

    public PiiPatternTable getPiiPatterns() {
        return piiPatterns;
    }

    private static boolean isNetworkScheme(String scheme) {
        String lower = scheme.toLowerCase(Locale.ROOT);
        return lower.equals("http") || lower.equals("https") || lower.equals("ws") || lower.equals("wss");
    }

    private static String abbreviate(String url) {
        return url.length() <= 120 ? url : url.substring(0, 120) + "...";
    }
}
