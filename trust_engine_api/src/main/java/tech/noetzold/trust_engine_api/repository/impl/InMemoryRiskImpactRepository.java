package tech.noetzold.trust_engine_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.trust_engine_api.model.RiskImpactEntry;
import tech.noetzold.trust_engine_api.repository.RiskImpactRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
public class InMemoryRiskImpactRepository implements RiskImpactRepository {

    private static final String TABLE_VERSION = "atlas-2025.1";
    private static final Map<String, RiskImpactEntry> DB = new LinkedHashMap<>();

    static {
        // industry averages per vulnerability class, CVSS-aligned
        register(new RiskImpactEntry("Critical RCE", 0.8, 4_200_000, 2));
        register(new RiskImpactEntry("Data Exposure", 0.7, 2_800_000, 3));
        register(new RiskImpactEntry("Privilege Escalation", 0.5, 1_900_000, 3));
        register(new RiskImpactEntry("DoS/Availability", 0.5, 850_000, 2));
        register(new RiskImpactEntry("Info Disclosure", 0.3, 320_000, 1));
        register(new RiskImpactEntry("Misconfiguration", 0.6, 12_000, 1));
    }

    private static void register(RiskImpactEntry entry) {
        DB.put(key(entry.category()), entry);
    }

    private static String key(String category) {
        return category.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public Optional<RiskImpactEntry> findByCategory(String category) {
        if (category == null || category.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(DB.get(key(category)));
    }

    @Override
    public List<RiskImpactEntry> findAll() {
        return List.copyOf(DB.values());
    }

    @Override
    public String tableVersion() {
        return TABLE_VERSION;
    }
}
