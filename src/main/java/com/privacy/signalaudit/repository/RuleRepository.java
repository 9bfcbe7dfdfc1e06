package com.privacy.signalaudit.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.privacy.signalaudit.config.ScanConfig;
import com.privacy.signalaudit.model.Rule;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Read-only access to the static rule dataset. The dataset is parsed once
 * and cached in memory, grouped by jurisdiction in file order.
 */
@Repository
public class RuleRepository {

    private static final Logger log = LoggerFactory.getLogger(RuleRepository.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    // Jurisdiction (upper case) -> rules in dataset order
    private final AtomicReference<Map<String, List<Rule>>> cachedRules = new AtomicReference<>(Map.of());
    private final AtomicReference<String> datasetVersion = new AtomicReference<>();

    public RuleRepository(ResourceLoader resourceLoader, ObjectMapper objectMapper, ScanConfig scanConfig) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = scanConfig.getRulesLocation();
    }

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * Re-read the dataset. On failure the previous cache is kept.
     *
     * @return number of rules loaded, or -1 when the dataset could not be read
     */
    public int reload() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("Rule dataset not found at {}", location);
            return -1;
        }
        try (InputStream in = resource.getInputStream()) {
            RuleDataset dataset = objectMapper.readValue(in, RuleDataset.class);
            Map<String, List<Rule>> grouped = group(dataset.getRules());
            cachedRules.set(grouped);
            datasetVersion.set(dataset.getVersion());
            int total = grouped.values().stream().mapToInt(List::size).sum();
            log.info("Loaded {} rules (dataset version {}) for jurisdictions {} from {}",
                    total, dataset.getVersion(), grouped.keySet(), location);
            return total;
        } catch (IOException e) {
            log.error("Failed to load rule dataset from {}: {}", location, e.getMessage(), e);
            return -1;
        }
    }

    /**
     * All rules of a jurisdiction, in dataset order. Empty when unknown.
     */
    public List<Rule> findByJurisdiction(String jurisdiction) {
        if (jurisdiction == null) {
            return List.of();
        }
        return cachedRules.get().getOrDefault(jurisdiction.toUpperCase(Locale.ROOT), List.of());
    }

    /**
     * Rules of a jurisdiction that should be evaluated. With {@code skipSuperseded}
     * a rule named in another rule's {@code supersedes} field is left out.
     */
    public List<Rule> findApplicable(String jurisdiction, boolean skipSuperseded) {
        List<Rule> rules = findByJurisdiction(jurisdiction);
        if (!skipSuperseded) {
            return rules;
        }
        Set<String> superseded = new HashSet<>();
        for (Rule rule : rules) {
            if (rule.getSupersedes() != null) {
                superseded.add(rule.getSupersedes());
            }
        }
        if (superseded.isEmpty()) {
            return rules;
        }
        log.debug("Skipping superseded rules {} for {}", superseded, jurisdiction);
        return rules.stream()
                .filter(rule -> !superseded.contains(rule.getRuleId()))
                .toList();
    }

    public Set<String> getJurisdictions() {
        return cachedRules.get().keySet();
    }

    public String getDatasetVersion() {
        return datasetVersion.get();
    }

    private static Map<String, List<Rule>> group(List<Rule> rules) {
        Map<String, List<Rule>> grouped = new LinkedHashMap<>();
        if (rules == null) {
            return grouped;
        }
        Set<String> ids = new HashSet<>();
        for (Rule rule : rules) {
            if (rule.getRuleId() == null || rule.getJurisdiction() == null) {
                log.warn("Ignoring rule without id or jurisdiction: {}", rule);
                continue;
            }
            if (!ids.add(rule.getRuleId())) {
                log.warn("Ignoring duplicate rule id {}", rule.getRuleId());
                continue;
            }
            grouped.computeIfAbsent(rule.getJurisdiction().toUpperCase(Locale.ROOT), k -> new ArrayList<>()).add(rule);
        }
        grouped.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return Collections.unmodifiableMap(grouped);
    }
}
