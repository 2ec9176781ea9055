package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ClusterCoverage(
        @JsonProperty("cluster_id") String clusterId,
        double coverage,
        @JsonProperty("best_evidence_id") String bestEvidenceId
) {}
