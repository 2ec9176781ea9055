package tech.noetzold.trust_engine_api.repository;

import tech.noetzold.trust_engine_api.model.RiskImpactEntry;

import java.util.List;
import java.util.Optional;

public interface RiskImpactRepository {
    Optional<RiskImpactEntry> findByCategory(String category);

    List<RiskImpactEntry> findAll();

    String tableVersion();
}
