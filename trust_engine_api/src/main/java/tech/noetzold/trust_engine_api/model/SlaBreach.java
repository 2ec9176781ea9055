package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record SlaBreach(
        @JsonProperty("incident_id") String incidentId,
        @JsonProperty("decision_id") String decisionId,
        List<StakeholderRole> route,
        @JsonProperty("sla_deadline") Instant slaDeadline,
        @JsonProperty("overdue_minutes") long overdueMinutes,
        IncidentLifecycle state
) {}
