package tech.noetzold.trust_engine_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.trust_engine_api.repository.OrganizationSettingsRepository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryOrganizationSettingsRepository implements OrganizationSettingsRepository {

    private final Map<String, Map<String, Double>> weights = new ConcurrentHashMap<>();

    @Override
    public Map<String, Double> findFrameworkWeights(String orgId) {
        return weights.getOrDefault(orgId, Map.of());
    }

    @Override
    public void saveFrameworkWeights(String orgId, Map<String, Double> frameworkWeights) {
        weights.put(orgId, Map.copyOf(frameworkWeights));
    }
}
