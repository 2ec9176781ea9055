package tech.noetzold.trust_engine_api.model;

import jakarta.validation.constraints.NotBlank;

/** Admin assertion that two controls express the same requirement. */
public record ControlOverride(
        @NotBlank String control_a,
        @NotBlank String control_b
) {}
