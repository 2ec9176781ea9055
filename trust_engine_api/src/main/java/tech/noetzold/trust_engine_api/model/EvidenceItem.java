package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * One revision of an evidence item. Status transitions produce a new revision;
 * earlier revisions stay in the ledger history.
 */
@Builder(toBuilder = true)
public record EvidenceItem(
        @JsonProperty("evidence_id") String evidenceId,
        @JsonProperty("org_id") String orgId,
        @JsonProperty("cluster_id") String clusterId,
        @JsonProperty("anchor_control") ControlRef anchorControl,
        double confidence,
        EvidenceStatus status,
        @JsonProperty("collected_at") Instant collectedAt,
        @JsonProperty("ingested_at") Instant ingestedAt,
        @JsonProperty("contribution_weight") double contributionWeight,
        @JsonProperty("source_system") String sourceSystem,
        int revision
) {
    public EvidenceItem withStatus(EvidenceStatus next) {
        return toBuilder().status(next).revision(revision + 1).build();
    }
}
