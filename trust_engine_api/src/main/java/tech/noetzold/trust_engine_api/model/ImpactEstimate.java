package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ImpactEstimate(
        String category,
        @JsonProperty("base_cost") double baseCost,
        @JsonProperty("applied_multipliers") Map<String, Double> appliedMultipliers,
        @JsonProperty("combined_multiplier") double combinedMultiplier,
        boolean capped,
        @JsonProperty("estimated_impact") double estimatedImpact
) {}
