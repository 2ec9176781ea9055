package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.SortedSet;

/**
 * Issued once per routing evaluation and never changed afterwards. A re-evaluation
 * issues a new decision that points back at the one it supersedes.
 */
@Builder(toBuilder = true)
public record RoutingDecision(
        @JsonProperty("decision_id") String decisionId,
        @JsonProperty("org_id") String orgId,
        @JsonProperty("incident_id") String incidentId,
        String category,
        @JsonProperty("context_tags") SortedSet<String> contextTags,
        @JsonProperty("estimated_impact") double estimatedImpact,
        @JsonProperty("matched_threshold") RiskAppetiteThreshold matchedThreshold,
        List<StakeholderRole> route,
        @JsonProperty("threshold_route") List<StakeholderRole> thresholdRoute,
        @JsonProperty("sla_minutes") int slaMinutes,
        @JsonProperty("exception_applied") boolean exceptionApplied,
        @JsonProperty("exception_pattern_id") String exceptionPatternId,
        RoutingOutcome outcome,
        @JsonProperty("configuration_error") boolean configurationError,
        @JsonProperty("routed_at") Instant routedAt,
        @JsonProperty("sla_deadline") Instant slaDeadline,
        @JsonProperty("supersedes_decision_id") String supersedesDecisionId
) {
    public boolean requiresHuman() {
        return outcome != RoutingOutcome.AUTO_RESOLVED;
    }
}
