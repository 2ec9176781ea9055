package tech.noetzold.trust_engine_api.repository;

import java.util.Map;

public interface OrganizationSettingsRepository {
    Map<String, Double> findFrameworkWeights(String orgId);

    void saveFrameworkWeights(String orgId, Map<String, Double> weights);
}
