package tech.noetzold.trust_engine_api.model;

import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record FrameworkWeightsRequest(@NotNull Map<String, Double> weights) {}
