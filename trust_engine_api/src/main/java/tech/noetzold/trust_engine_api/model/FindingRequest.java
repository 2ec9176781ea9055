package tech.noetzold.trust_engine_api.model;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record FindingRequest(
        String incident_id,
        @NotBlank String category,
        List<String> context_tags
) {}
