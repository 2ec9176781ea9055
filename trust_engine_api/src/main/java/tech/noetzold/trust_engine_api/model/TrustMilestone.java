package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record TrustMilestone(
        boolean achieved,
        String name,
        String description,
        @JsonProperty("target_score") double targetScore,
        double gap,
        List<String> requirements
) {
    public TrustMilestone {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }
}
