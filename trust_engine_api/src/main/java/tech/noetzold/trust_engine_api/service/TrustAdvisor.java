package tech.noetzold.trust_engine_api.service;

import tech.noetzold.trust_engine_api.model.*;
import tech.noetzold.trust_engine_api.model.TrustRecommendation.Priority;
import tech.noetzold.trust_engine_api.model.TrustRecommendation.Type;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a computed coverage picture into ranked recommendations and the next score
 * milestone. Gains are the overall-score points an action would add, using the same
 * framework weighting as the overall score.
 */
public class TrustAdvisor {

    static final double WEAK_FRAMEWORK_SCORE = 50.0;
    static final double MILESTONE_WEAK_FRAMEWORK_SCORE = 60.0;
    static final double LOW_CONFIDENCE = 0.6;
    static final int LOW_CONFIDENCE_MIN_ITEMS = 4;
    static final int MAX_GAP_RECOMMENDATIONS = 5;

    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private static final List<Milestone> MILESTONES = List.of(
            new Milestone(70, "SOC2 Ready", "Ready for a SOC 2 Type I audit"),
            new Milestone(80, "Enterprise Ready", "Strong compliance posture across frameworks"),
            new Milestone(90, "Best in Class", "Industry-leading control coverage"),
            new Milestone(95, "Zero Trust", "Maximum assurance posture"));

    private static final Comparator<TrustRecommendation> ORDER = Comparator
            .comparing(TrustRecommendation::priority)
            .thenComparing(TrustAdvisor::gainOf, Comparator.reverseOrder())
            .thenComparing(TrustRecommendation::title);

    private final StalenessDecay decay;

    public TrustAdvisor(StalenessDecay decay) {
        this.decay = decay;
    }

    public List<TrustRecommendation> recommend(ClusterMapping mapping,
                                               Map<String, FrameworkScore> perFramework,
                                               Map<String, ClusterCoverage> perCluster,
                                               Collection<EvidenceItem> orgEvidence,
                                               Map<String, Double> frameworkWeights,
                                               Instant asOf) {
        Weights weights = new Weights(perFramework, frameworkWeights);
        List<TrustRecommendation> out = new ArrayList<>();

        perFramework.values().forEach(fs -> {
            if (fs.controlCount() > 0 && fs.score() < WEAK_FRAMEWORK_SCORE) {
                out.add(new TrustRecommendation(Type.FRAMEWORK, Priority.HIGH,
                        "Improve " + fs.frameworkId() + " coverage",
                        String.format(Locale.ROOT, "Score %.1f with %d of %d requirement clusters evidenced.",
                                fs.score(), fs.coveredClusters(), fs.totalClusters()),
                        null, fs.frameworkId(), weights.share(fs.frameworkId()) * (100.0 - fs.score())));
            }
        });

        mapping.getClusters().stream()
                .filter(c -> perCluster.get(c.clusterId()).coverage() == 0.0)
                .map(c -> gapRecommendation(c, perFramework, weights))
                .sorted(Comparator.comparing(TrustRecommendation::estimatedGain, Comparator.reverseOrder())
                        .thenComparing(TrustRecommendation::clusterId))
                .limit(MAX_GAP_RECOMMENDATIONS)
                .forEach(out::add);

        Map<String, EvidenceItem> byId = new HashMap<>();
        orgEvidence.forEach(e -> byId.put(e.evidenceId(), e));
        int stale = 0;
        double staleGain = 0.0;
        for (CanonicalCluster c : mapping.getClusters()) {
            ClusterCoverage cov = perCluster.get(c.clusterId());
            EvidenceItem best = cov.bestEvidenceId() != null ? byId.get(cov.bestEvidenceId()) : null;
            if (best == null || ageDays(best, asOf) <= decay.getFreshnessDays()) continue;
            stale++;
            double fresh = best.confidence() * best.contributionWeight();
            staleGain += clusterGain(c, fresh - cov.coverage(), perFramework, weights);
        }
        if (stale > 0) {
            out.add(new TrustRecommendation(Type.STALE_EVIDENCE, Priority.LOW,
                    "Refresh " + stale + " stale evidence item" + (stale == 1 ? "" : "s"),
                    "Best evidence older than " + (long) decay.getFreshnessDays() + " days is discounted.",
                    null, null, staleGain));
        }

        long pending = orgEvidence.stream().filter(e -> e.status() == EvidenceStatus.PENDING).count();
        if (pending > 0) {
            out.add(new TrustRecommendation(Type.PENDING_REVIEW, Priority.MEDIUM,
                    "Review " + pending + " pending evidence item" + (pending == 1 ? "" : "s"),
                    "Pending evidence does not count toward coverage until verified.",
                    null, null, null));
        }

        long weak = orgEvidence.stream()
                .filter(e -> e.status().countsForCoverage() && e.confidence() < LOW_CONFIDENCE)
                .count();
        if (weak >= LOW_CONFIDENCE_MIN_ITEMS) {
            out.add(new TrustRecommendation(Type.LOW_CONFIDENCE, Priority.MEDIUM,
                    "Improve evidence quality",
                    weak + " counted evidence items have confidence below " + LOW_CONFIDENCE + ".",
                    null, null, null));
        }

        out.sort(ORDER);
        return out;
    }

    public TrustMilestone nextMilestone(double overallScore,
                                        Map<String, FrameworkScore> perFramework,
                                        int uncoveredClusters) {
        Milestone next = MILESTONES.stream()
                .filter(m -> overallScore < m.score())
                .findFirst()
                .orElse(null);
        if (next == null) {
            Milestone top = MILESTONES.get(MILESTONES.size() - 1);
            return new TrustMilestone(true, top.name(), top.description(), top.score(), 0.0, List.of());
        }

        List<String> requirements = new ArrayList<>();
        perFramework.values().stream()
                .filter(fs -> fs.controlCount() > 0)
                .min(Comparator.comparingDouble(FrameworkScore::score).thenComparing(FrameworkScore::frameworkId))
                .filter(fs -> fs.score() < MILESTONE_WEAK_FRAMEWORK_SCORE)
                .ifPresent(fs -> requirements.add("Improve " + fs.frameworkId() + " coverage"));
        if (uncoveredClusters > 0) {
            requirements.add("Evidence " + uncoveredClusters + " uncovered requirement cluster"
                    + (uncoveredClusters == 1 ? "" : "s"));
        }
        return new TrustMilestone(false, next.name(), next.description(), next.score(),
                next.score() - overallScore, requirements);
    }

    private TrustRecommendation gapRecommendation(CanonicalCluster c,
                                                  Map<String, FrameworkScore> perFramework,
                                                  Weights weights) {
        int controls = c.memberControls().size();
        Priority priority = c.frameworks().size() > 1 ? Priority.HIGH : Priority.MEDIUM;
        return new TrustRecommendation(Type.EVIDENCE_GAP, priority,
                "Collect evidence for " + c.clusterId(),
                "'" + c.representativeDescription() + "' satisfies " + controls + " control"
                        + (controls == 1 ? "" : "s") + " in " + String.join(", ", c.frameworks()) + ".",
                c.clusterId(), null, clusterGain(c, 1.0, perFramework, weights));
    }

    private static double clusterGain(CanonicalCluster c,
                                      double coverageDelta,
                                      Map<String, FrameworkScore> perFramework,
                                      Weights weights) {
        double gain = 0.0;
        for (String fw : c.frameworks()) {
            FrameworkScore fs = perFramework.get(fw);
            if (fs == null || fs.controlCount() == 0) continue;
            gain += weights.share(fw) * 100.0 * coverageDelta * c.controlCountIn(fw) / fs.controlCount();
        }
        return gain;
    }

    private static Double gainOf(TrustRecommendation r) {
        return r.estimatedGain() == null ? 0.0 : r.estimatedGain();
    }

    private static double ageDays(EvidenceItem item, Instant asOf) {
        return Math.max(0.0, Duration.between(item.collectedAt(), asOf).toMillis() / MILLIS_PER_DAY);
    }

    private record Milestone(double score, String name, String description) {}

    /** Framework weight relative to the sum used for the overall score. */
    private static final class Weights {
        private final Map<String, Double> configured;
        private final double total;

        Weights(Map<String, FrameworkScore> perFramework, Map<String, Double> configured) {
            this.configured = configured != null ? configured : Map.of();
            double sum = 0.0;
            for (String fw : perFramework.keySet()) {
                sum += this.configured.getOrDefault(fw, 1.0);
            }
            this.total = sum;
        }

        double share(String frameworkId) {
            return total == 0.0 ? 0.0 : configured.getOrDefault(frameworkId, 1.0) / total;
        }
    }
}
