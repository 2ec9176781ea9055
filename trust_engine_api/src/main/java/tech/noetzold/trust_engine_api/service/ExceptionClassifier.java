package tech.noetzold.trust_engine_api.service;

import tech.noetzold.trust_engine_api.model.ExceptionMatch;

import java.util.Optional;
import java.util.Set;

/**
 * Proposes a route that overrides threshold routing for findings that match a known
 * exception. The routing engine applies the proposal only when its confidence clears
 * the configured cutoff.
 */
public interface ExceptionClassifier {

    Optional<ExceptionMatch> classify(String orgId, String category, Set<String> contextTags);
}
