package tech.noetzold.trust_engine_api.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CatalogImportRequest(
        @NotEmpty List<@Valid Control> controls,
        Double similarity_threshold,
        List<ControlOverride> overrides
) {}
