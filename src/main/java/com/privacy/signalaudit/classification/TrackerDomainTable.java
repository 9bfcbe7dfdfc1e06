package com.privacy.signalaudit.classification;

import com.privacy.signalaudit.config.ClassificationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Known tracker domains. A host is a tracker when it equals an entry or is
 * a subdomain of one ({@code www.google-analytics.com} matches
 * {@code google-analytics.com}, {@code notgoogle-analytics.com} does not).
 */
@Component
public class TrackerDomainTable {

    private static final Logger log = LoggerFactory.getLogger(TrackerDomainTable.class);

    private final Set<String> domains;

    @Autowired
    public TrackerDomainTable(ClassificationConfig config) {
        this(config.getTrackerDomains());
        log.info("Loaded {} tracker domains", domains.size());
    }

    public TrackerDomainTable(Collection<String> entries) {
        Set<String> normalized = new LinkedHashSet<>();
        if (entries != null) {
            for (String entry : entries) {
                if (entry == null || entry.isBlank()) {
                    continue;
                }
                String domain = entry.trim().toLowerCase(Locale.ROOT);
                if (domain.startsWith(".")) {
                    domain = domain.substring(1);
                }
                normalized.add(domain);
            }
        }
        this.domains = Collections.unmodifiableSet(normalized);
    }

    public boolean matches(String host) {
        if (host == null || host.isEmpty()) {
            return false;
        }
        String candidate = host.toLowerCase(Locale.ROOT);
        if (candidate.endsWith(".")) {
            candidate = candidate.substring(0, candidate.length() - 1);
        }
        if (domains.contains(candidate)) {
            return true;
        }
        // Walk up the parent domains: a.b.tracker.com -> b.tracker.com -> tracker.com
        int dot = candidate.indexOf('.');
        while (dot >= 0) {
            candidate = candidate.substring(dot + 1);
            if (domains.contains(candidate)) {
                return true;
            }
            dot = candidate.indexOf('.');
        }
        return false;
    }

    public boolean isEmpty() {
        return domains.isEmpty();
    }

    public int size() {
        return domains.size();
    }

    public Set<String> getDomains() {
        return domains;
    }
}
