package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.SortedSet;

/**
 * A learned routing exception: when a finding carries every required tag (and the
 * category, if set) the pattern proposes its own route. Confidence comes from
 * feedback counts.
 */
public record ExceptionPattern(
        @JsonProperty("pattern_id") String patternId,
        @JsonProperty("org_id") String orgId,
        String category,
        @JsonProperty("required_tags") SortedSet<String> requiredTags,
        List<StakeholderRole> route,
        @JsonProperty("sla_minutes") int slaMinutes,
        int observations,
        int confirmations
) {
    public ExceptionPattern {
        route = List.copyOf(route);
    }

    /** Laplace-smoothed share of confirmed overrides. */
    public double confidence() {
        return (confirmations + 1.0) / (observations + 2.0);
    }

    public boolean matches(String findingCategory, java.util.Set<String> tags) {
        if (category != null && !category.equalsIgnoreCase(findingCategory)) return false;
        return !requiredTags.isEmpty() && tags.containsAll(requiredTags);
    }

    public ExceptionPattern withFeedback(boolean confirmed) {
        return new ExceptionPattern(patternId, orgId, category, requiredTags, route, slaMinutes,
                observations + 1, confirmed ? confirmations + 1 : confirmations);
    }
}
