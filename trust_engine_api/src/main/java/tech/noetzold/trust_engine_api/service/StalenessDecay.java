package tech.noetzold.trust_engine_api.service;

import tech.noetzold.trust_engine_api.model.EvidenceItem;

import java.time.Duration;
import java.time.Instant;

/**
 * Age discount for evidence: 1.0 inside the freshness window, then a straight line
 * down to {@code floor} at twice the window, then flat at the floor.
 */
public class StalenessDecay {

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final double freshnessDays;
    private final double floor;

    public StalenessDecay(double freshnessDays, double floor) {
        if (!(freshnessDays > 0)) {
            throw new IllegalArgumentException("freshness window must be positive");
        }
        if (!(floor > 0.0 && floor <= 1.0)) {
            throw new IllegalArgumentException("decay floor must be within (0, 1]");
        }
        this.freshnessDays = freshnessDays;
        this.floor = floor;
    }

    public double factor(double ageDays) {
        if (ageDays <= freshnessDays) return 1.0;
        if (ageDays >= 2 * freshnessDays) return floor;
        double progress = (ageDays - freshnessDays) / freshnessDays;
        return Math.max(floor, 1.0 - (1.0 - floor) * progress);
    }

    public double effectiveConfidence(EvidenceItem item, Instant asOf) {
        double ageDays = Math.max(0.0, Duration.between(item.collectedAt(), asOf).toMillis() / MILLIS_PER_DAY);
        return item.confidence() * item.contributionWeight() * factor(ageDays);
    }

    public double getFreshnessDays() {
        return freshnessDays;
    }

    public double getFloor() {
        return floor;
    }
}
