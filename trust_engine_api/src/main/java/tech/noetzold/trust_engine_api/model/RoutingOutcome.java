package tech.noetzold.trust_engine_api.model;

public enum RoutingOutcome {
    ROUTED,
    AUTO_RESOLVED,
    MANUAL_TRIAGE
}
