package tech.noetzold.trust_engine_api.model;

import jakarta.validation.constraints.NotNull;

public record StatusTransitionRequest(
        @NotNull EvidenceStatus expected,
        @NotNull EvidenceStatus next
) {}
