package tech.noetzold.trust_engine_api.model;

public enum StakeholderRole {
    BOARD,
    CEO,
    CISO,
    CTO,
    DPO,
    LEGAL,
    COMPLIANCE,
    PR,
    HR,
    SECURITY_TEAM,
    // no human stakeholder
    AUTO_RESOLVED,
    MANUAL_TRIAGE
}
