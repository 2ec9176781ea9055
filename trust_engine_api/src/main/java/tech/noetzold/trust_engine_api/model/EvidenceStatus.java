package tech.noetzold.trust_engine_api.model;

public enum EvidenceStatus {
    PENDING,
    VERIFIED,
    REJECTED,
    AUTO_APPROVED;

    /** Only verified or auto-approved evidence counts towards coverage. */
    public boolean countsForCoverage() {
        return this == VERIFIED || this == AUTO_APPROVED;
    }
}
