package tech.noetzold.trust_engine_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.trust_engine_api.model.RoutingDecision;
import tech.noetzold.trust_engine_api.repository.RoutingDecisionRepository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryRoutingDecisionRepository implements RoutingDecisionRepository {

    private final Map<String, RoutingDecision> byId = new ConcurrentHashMap<>();
    private final Map<String, List<RoutingDecision>> byIncident = new ConcurrentHashMap<>();

    @Override
    public RoutingDecision append(RoutingDecision decision) {
        if (byId.putIfAbsent(key(decision.orgId(), decision.decisionId()), decision) != null) {
            throw new IllegalStateException("decision " + decision.decisionId() + " already issued");
        }
        byIncident.computeIfAbsent(key(decision.orgId(), decision.incidentId()), k -> new CopyOnWriteArrayList<>())
                .add(decision);
        return decision;
    }

    @Override
    public Optional<RoutingDecision> findById(String orgId, String decisionId) {
        if (decisionId == null) return Optional.empty();
        return Optional.ofNullable(byId.get(key(orgId, decisionId)));
    }

    @Override
    public List<RoutingDecision> findByIncident(String orgId, String incidentId) {
        return List.copyOf(byIncident.getOrDefault(key(orgId, incidentId), List.of()));
    }

    private static String key(String orgId, String id) {
        return orgId + "/" + id;
    }
}
