package tech.noetzold.trust_engine_api.repository;

import tech.noetzold.trust_engine_api.model.RiskAppetiteThreshold;

import java.util.List;

public interface ThresholdRepository {
    List<RiskAppetiteThreshold> findByOrg(String orgId);

    void replace(String orgId, List<RiskAppetiteThreshold> thresholds);
}
