package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrustGrade {
    A_PLUS("A+", 95),
    A("A", 90),
    A_MINUS("A-", 85),
    B_PLUS("B+", 80),
    B("B", 75),
    B_MINUS("B-", 70),
    C_PLUS("C+", 65),
    C("C", 60),
    D("D", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double minScore;

    TrustGrade(String label, double minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    public static TrustGrade of(double score) {
        for (TrustGrade g : values()) {
            if (score >= g.minScore) return g;
        }
        return D;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
