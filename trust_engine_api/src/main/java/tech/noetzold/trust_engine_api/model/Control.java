package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * A single requirement as a framework words it. Framework specific fields
 * (article numbers, annex references, ...) live in {@code attributes}.
 */
public record Control(
        @JsonProperty("framework_id") @NotBlank String frameworkId,
        @JsonProperty("control_id") @NotBlank String controlId,
        String category,
        @NotBlank String description,
        @JsonProperty("risk_level") RiskLevel riskLevel,
        Map<String, String> attributes
) {
    public Control {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        if (riskLevel == null) riskLevel = RiskLevel.MEDIUM;
    }

    @JsonIgnore
    public ControlRef ref() {
        return new ControlRef(frameworkId, controlId);
    }
}
