package com.privacy.signalaudit.service.enrichment;

import com.privacy.signalaudit.model.Enrichment;
import com.privacy.signalaudit.model.Rule;
import com.privacy.signalaudit.model.Violation;

import java.util.Optional;

/**
 * Produces human-readable explanations for a violation. Candidates are tried
 * in order until one answers.
 */
public interface EnrichmentProvider {

    String getName();

    /**
     * @return the explanations, or empty when the provider had no usable answer
     * @throws RuntimeException on transport or provider errors; callers fall through to the next provider
     */
    Optional<Enrichment> enrich(Violation violation, Rule rule);
}
