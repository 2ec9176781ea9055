package tech.noetzold.trust_engine_api.model;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record ThresholdRequest(
        @NotNull Double min_impact,
        Double max_impact,
        @NotEmpty List<StakeholderRole> route,
        @NotNull Integer sla_minutes
) {}
