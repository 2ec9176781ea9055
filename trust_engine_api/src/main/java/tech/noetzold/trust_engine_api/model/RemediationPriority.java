package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RemediationPriority(
        int rank,
        String category,
        @JsonProperty("priority_score") double priorityScore,
        @JsonProperty("average_incident_cost") double averageIncidentCost,
        double likelihood
) {}
