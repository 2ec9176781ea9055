package tech.noetzold.trust_engine_api.repository;

import tech.noetzold.trust_engine_api.model.RoutingDecision;

import java.util.List;
import java.util.Optional;

public interface RoutingDecisionRepository {
    RoutingDecision append(RoutingDecision decision);

    Optional<RoutingDecision> findById(String orgId, String decisionId);

    List<RoutingDecision> findByIncident(String orgId, String incidentId);
}
