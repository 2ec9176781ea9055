package tech.noetzold.trust_engine_api.service;

import tech.noetzold.trust_engine_api.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Pure coverage and trust score computation over a mapping snapshot and an
 * evidence snapshot. Holds no state besides the decay policy.
 */
public class CoverageCalculator {

    private final StalenessDecay decay;
    private final TrustAdvisor advisor;

    public CoverageCalculator(StalenessDecay decay) {
        this.decay = decay;
        this.advisor = new TrustAdvisor(decay);
    }

    public CoverageReport compute(String orgId,
                                  ClusterMapping mapping,
                                  Collection<EvidenceItem> evidence,
                                  Instant asOf,
                                  Map<String, Double> frameworkWeights) {
        List<EvidenceItem> orgEvidence = evidence.stream()
                .filter(e -> orgId.equals(e.orgId()))
                .collect(Collectors.toList());
        Map<String, ClusterCoverage> perCluster = clusterCoverage(orgId, mapping, orgEvidence, asOf);

        Map<String, FrameworkScore> perFramework = mapping.frameworks().parallelStream()
                .map(fw -> frameworkScore(fw, mapping, perCluster))
                .collect(Collectors.toMap(FrameworkScore::frameworkId, s -> s, (a, b) -> a, TreeMap::new));

        double overall = overallScore(perFramework, frameworkWeights);

        List<String> gaps = new ArrayList<>();
        perCluster.values().forEach(c -> {
            if (c.coverage() == 0.0) gaps.add(c.clusterId());
        });

        List<TrustRecommendation> recommendations =
                advisor.recommend(mapping, perFramework, perCluster, orgEvidence, frameworkWeights, asOf);
        TrustMilestone milestone = advisor.nextMilestone(overall, perFramework, gaps.size());

        return new CoverageReport(orgId, mapping.getVersion(), overall, TrustGrade.of(overall),
                perFramework, perCluster, gaps, recommendations, milestone, asOf);
    }

    Map<String, ClusterCoverage> clusterCoverage(String orgId,
                                                 ClusterMapping mapping,
                                                 Collection<EvidenceItem> evidence,
                                                 Instant asOf) {
        Map<String, Double> best = new LinkedHashMap<>();
        Map<String, String> bestId = new LinkedHashMap<>();
        for (CanonicalCluster c : mapping.getClusters()) {
            best.put(c.clusterId(), 0.0);
        }

        for (EvidenceItem item : evidence) {
            if (!orgId.equals(item.orgId()) || !item.status().countsForCoverage()) continue;
            // cluster ids are positional, so an anchored item whose control left the catalog covers nothing
            String clusterId = item.anchorControl() != null
                    ? mapping.clusterOf(item.anchorControl()).orElse(null)
                    : item.clusterId();
            Double current = clusterId != null ? best.get(clusterId) : null;
            if (current == null) continue;

            double effective = decay.effectiveConfidence(item, asOf);
            if (effective > current) {
                best.put(clusterId, effective);
                bestId.put(clusterId, item.evidenceId());
            }
        }

        Map<String, ClusterCoverage> out = new LinkedHashMap<>();
        best.forEach((id, cov) -> out.put(id, new ClusterCoverage(id, cov, bestId.get(id))));
        return out;
    }

    private FrameworkScore frameworkScore(String frameworkId,
                                          ClusterMapping mapping,
                                          Map<String, ClusterCoverage> perCluster) {
        double weighted = 0.0;
        long controls = 0;
        int clusters = 0;
        int covered = 0;
        for (CanonicalCluster c : mapping.getClusters()) {
            long weight = c.controlCountIn(frameworkId);
            if (weight == 0) continue;
            double coverage = perCluster.get(c.clusterId()).coverage();
            weighted += coverage * weight;
            controls += weight;
            clusters++;
            if (coverage > 0.0) covered++;
        }
        double score = controls == 0 ? 0.0 : 100.0 * weighted / controls;
        return new FrameworkScore(frameworkId, score, controls, covered, clusters);
    }

    private double overallScore(Map<String, FrameworkScore> perFramework, Map<String, Double> weights) {
        double total = 0.0;
        double weightSum = 0.0;
        for (FrameworkScore fs : perFramework.values()) {
            double w = weights != null ? weights.getOrDefault(fs.frameworkId(), 1.0) : 1.0;
            total += fs.score() * w;
            weightSum += w;
        }
        return weightSum == 0.0 ? 0.0 : total / weightSum;
    }
}
