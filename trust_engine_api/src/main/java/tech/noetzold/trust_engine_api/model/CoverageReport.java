package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CoverageReport(
        @JsonProperty("org_id") String orgId,
        @JsonProperty("mapping_version") long mappingVersion,
        @JsonProperty("overall_score") double overallScore,
        TrustGrade grade,
        @JsonProperty("per_framework") Map<String, FrameworkScore> perFramework,
        @JsonProperty("per_cluster") Map<String, ClusterCoverage> perCluster,
        @JsonProperty("evidence_gaps") List<String> evidenceGaps,
        List<TrustRecommendation> recommendations,
        @JsonProperty("next_milestone") TrustMilestone nextMilestone,
        @JsonProperty("as_of") Instant asOf
) {}
