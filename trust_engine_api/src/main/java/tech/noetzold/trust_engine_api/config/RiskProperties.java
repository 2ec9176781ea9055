package tech.noetzold.trust_engine_api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Impact adjustment per context tag ({@code trust-engine.risk.tag-multipliers.<tag>}) and the
 * cap on the combined multiplier.
 */
@ConfigurationProperties(prefix = "trust-engine.risk")
public record RiskProperties(Map<String, Double> tagMultipliers,
                             @DefaultValue("3.0") double multiplierCeiling) {

    static final Map<String, Double> DEFAULT_TAG_MULTIPLIERS = defaults();

    public RiskProperties {
        tagMultipliers = tagMultipliers == null ? DEFAULT_TAG_MULTIPLIERS : Map.copyOf(tagMultipliers);
    }

    private static Map<String, Double> defaults() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("high-value-customer", 1.3);
        m.put("regulatory-audit", 1.5);
        m.put("production", 1.2);
        m.put("pii", 1.4);
        m.put("internet-facing", 1.25);
        m.put("compensating-control", 0.8);
        return Map.copyOf(m);
    }
}
