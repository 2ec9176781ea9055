package tech.noetzold.trust_engine_api.model;

public enum RiskLevel {
    LOW, MEDIUM, HIGH, CRITICAL
}
