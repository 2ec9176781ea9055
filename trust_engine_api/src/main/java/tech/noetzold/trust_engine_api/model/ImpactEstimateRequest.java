package tech.noetzold.trust_engine_api.model;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record ImpactEstimateRequest(
        @NotBlank String category,
        List<String> context_tags
) {}
