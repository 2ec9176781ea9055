package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One action that would raise the organization's trust score. {@code estimatedGain} is in
 * overall-score points and absent when the effect cannot be derived from current data.
 */
public record TrustRecommendation(
        Type type,
        Priority priority,
        String title,
        String description,
        @JsonProperty("cluster_id") String clusterId,
        @JsonProperty("framework_id") String frameworkId,
        @JsonProperty("estimated_gain") Double estimatedGain
) {
    public enum Type {
        FRAMEWORK,
        EVIDENCE_GAP,
        STALE_EVIDENCE,
        PENDING_REVIEW,
        LOW_CONFIDENCE
    }

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }
}
