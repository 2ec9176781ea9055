package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record NormalizationSummary(
        @JsonProperty("mapping_version") long mappingVersion,
        @JsonProperty("catalog_version") long catalogVersion,
        @JsonProperty("controls_imported") int controlsImported,
        List<String> frameworks,
        @JsonProperty("clusters_created") int clustersCreated,
        @JsonProperty("merged_controls") int mergedControls,
        @JsonProperty("singleton_clusters") int singletonClusters,
        @JsonProperty("overrides_applied") int overridesApplied,
        @JsonProperty("dedup_ratio") double dedupRatio
) {}
