package tech.noetzold.trust_engine_api.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record EvidenceIngestRequest(
        String cluster_id,
        String raw_control_ref,        // framework:controlId
        @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,
        Instant collected_at,
        String source_system,
        Double contribution_weight
) {}
