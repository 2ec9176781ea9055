package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Impact band [minImpact, maxImpact) and the stakeholders it escalates to.
 * A null maxImpact marks the unbounded top band.
 */
public record RiskAppetiteThreshold(
        @JsonProperty("threshold_id") String thresholdId,
        @JsonProperty("min_impact") double minImpact,
        @JsonProperty("max_impact") Double maxImpact,
        List<StakeholderRole> route,
        @JsonProperty("sla_minutes") int slaMinutes
) {
    public RiskAppetiteThreshold {
        route = route == null ? List.of() : List.copyOf(route);
    }

    public boolean contains(double impact) {
        return impact >= minImpact && (maxImpact == null || impact < maxImpact);
    }

    @JsonIgnore
    public boolean isAutomatic() {
        return route.stream().allMatch(r -> r == StakeholderRole.AUTO_RESOLVED);
    }
}
