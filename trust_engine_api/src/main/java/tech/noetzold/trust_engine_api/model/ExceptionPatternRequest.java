package tech.noetzold.trust_engine_api.model;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ExceptionPatternRequest(
        String category,
        @NotEmpty List<String> required_tags,
        @NotEmpty List<StakeholderRole> route,
        @NotNull Integer sla_minutes
) {}
