package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record IncidentView(
        IncidentState incident,
        @JsonProperty("active_decision") RoutingDecision activeDecision,
        List<RoutingDecision> decisions
) {}
