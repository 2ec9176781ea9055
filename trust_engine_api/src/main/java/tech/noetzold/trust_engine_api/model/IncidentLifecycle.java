package tech.noetzold.trust_engine_api.model;

import java.util.EnumSet;
import java.util.Set;

public enum IncidentLifecycle {
    RECEIVED,
    SCORED,
    ROUTED,
    ACKNOWLEDGED,
    ESCALATED,
    AUTO_RESOLVED;

    public Set<IncidentLifecycle> next() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(SCORED);
            case SCORED -> EnumSet.of(ROUTED, AUTO_RESOLVED);
            case ROUTED -> EnumSet.of(ACKNOWLEDGED, ESCALATED);
            case ESCALATED -> EnumSet.of(ACKNOWLEDGED, ESCALATED);
            case ACKNOWLEDGED, AUTO_RESOLVED -> EnumSet.noneOf(IncidentLifecycle.class);
        };
    }

    public boolean canMoveTo(IncidentLifecycle target) {
        return next().contains(target);
    }
}
