package tech.noetzold.trust_engine_api.service;

import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.ImpactEstimate;
import tech.noetzold.trust_engine_api.model.RemediationPriority;
import tech.noetzold.trust_engine_api.model.RiskImpactEntry;
import tech.noetzold.trust_engine_api.repository.RiskImpactRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Financial view of findings: remediation priority per category and the expected
 * incident cost adjusted by the finding's context tags.
 */
public class RiskImpactModel {

    private final RiskImpactRepository impactRepo;
    private final Map<String, Double> tagMultipliers;
    private final double multiplierCeiling;

    public RiskImpactModel(RiskImpactRepository impactRepo, Map<String, Double> tagMultipliers, double multiplierCeiling) {
        if (!(multiplierCeiling >= 1.0)) {
            throw new IllegalArgumentException("multiplier ceiling must be >= 1");
        }
        this.impactRepo = impactRepo;
        Map<String, Double> normalized = new LinkedHashMap<>();
        tagMultipliers.forEach((tag, m) -> {
            if (m == null || !(m > 0.0)) {
                throw new IllegalArgumentException("multiplier for tag " + tag + " must be positive");
            }
            normalized.put(normalizeTag(tag), m);
        });
        this.tagMultipliers = Map.copyOf(normalized);
        this.multiplierCeiling = multiplierCeiling;
    }

    public double priorityScore(String category) {
        return entry(category).priorityScore();
    }

    public ImpactEstimate estimateImpact(String category, Collection<String> contextTags) {
        RiskImpactEntry entry = entry(category);

        Map<String, Double> applied = new LinkedHashMap<>();
        double combined = 1.0;
        for (String tag : normalizeTags(contextTags)) {
            Double m = tagMultipliers.get(tag);
            if (m == null) continue;
            applied.put(tag, m);
            combined *= m;
        }
        boolean capped = combined > multiplierCeiling;
        double effective = capped ? multiplierCeiling : combined;

        return new ImpactEstimate(entry.category(), entry.averageIncidentCost(), applied,
                effective, capped, entry.averageIncidentCost() * effective);
    }

    /** Categories ordered by priority score, highest first; all known categories when none are given. */
    public List<RemediationPriority> rankRemediation(Collection<String> categories) {
        List<RiskImpactEntry> entries = new ArrayList<>();
        if (categories == null || categories.isEmpty()) {
            entries.addAll(impactRepo.findAll());
        } else {
            Set<String> seen = new LinkedHashSet<>();
            for (String c : categories) {
                RiskImpactEntry e = entry(c);
                if (seen.add(e.category())) entries.add(e);
            }
        }
        entries.sort(Comparator.comparingDouble(RiskImpactEntry::priorityScore).reversed()
                .thenComparing(RiskImpactEntry::category));

        List<RemediationPriority> plan = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            RiskImpactEntry e = entries.get(i);
            plan.add(new RemediationPriority(i + 1, e.category(), e.priorityScore(),
                    e.averageIncidentCost(), e.likelihood()));
        }
        return plan;
    }

    public RiskImpactEntry entry(String category) {
        return impactRepo.findByCategory(category)
                .orElseThrow(() -> new UnknownReferenceException("risk category", category));
    }

    public double getMultiplierCeiling() {
        return multiplierCeiling;
    }

    /** Trimmed, lower-cased, hyphenated and de-duplicated, so a repeated tag never compounds. */
    public static SortedSet<String> normalizeTags(Collection<String> tags) {
        SortedSet<String> out = new TreeSet<>();
        if (tags == null) return out;
        for (String t : tags) {
            if (t == null || t.isBlank()) continue;
            out.add(normalizeTag(t));
        }
        return out;
    }

    private static String normalizeTag(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "-");
    }
}
