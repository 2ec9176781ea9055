package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskImpactEntry(
        String category,
        double likelihood,
        @JsonProperty("average_incident_cost") double averageIncidentCost,
        @JsonProperty("complexity_to_remediate") double complexityToRemediate
) {
    public RiskImpactEntry {
        if (likelihood < 0.0 || likelihood > 1.0) {
            throw new IllegalArgumentException("likelihood must be within [0,1] for " + category);
        }
        if (averageIncidentCost < 0.0) {
            throw new IllegalArgumentException("averageIncidentCost must not be negative for " + category);
        }
    }

    /** likelihood * cost / max(complexity, 1): cheap fixes on likely, expensive categories rank first. */
    public double priorityScore() {
        return likelihood * averageIncidentCost / Math.max(complexityToRemediate, 1.0);
    }
}
