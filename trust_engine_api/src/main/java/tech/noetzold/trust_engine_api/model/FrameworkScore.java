package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FrameworkScore(
        @JsonProperty("framework_id") String frameworkId,
        double score,
        @JsonProperty("control_count") long controlCount,
        @JsonProperty("covered_clusters") int coveredClusters,
        @JsonProperty("total_clusters") int totalClusters
) {}
