package tech.noetzold.trust_engine_api.model;

import jakarta.validation.constraints.NotNull;

public record PatternFeedbackRequest(@NotNull Boolean override_correct) {}
