package tech.noetzold.trust_engine_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.trust_engine_api.model.RiskAppetiteThreshold;
import tech.noetzold.trust_engine_api.repository.ThresholdRepository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryThresholdRepository implements ThresholdRepository {

    private final Map<String, List<RiskAppetiteThreshold>> db = new ConcurrentHashMap<>();

    @Override
    public List<RiskAppetiteThreshold> findByOrg(String orgId) {
        if (orgId == null) return List.of();
        return db.getOrDefault(orgId, List.of());
    }

    @Override
    public void replace(String orgId, List<RiskAppetiteThreshold> thresholds) {
        db.put(orgId, List.copyOf(thresholds));
    }
}
