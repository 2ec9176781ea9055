package tech.noetzold.trust_engine_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.trust_engine_api.exception.ConfigurationException;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.RiskAppetiteThreshold;
import tech.noetzold.trust_engine_api.model.StakeholderRole;
import tech.noetzold.trust_engine_api.model.ThresholdRequest;
import tech.noetzold.trust_engine_api.repository.ThresholdRepository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Risk appetite configuration per organization. Every write is validated as a whole:
 * the bands must tile the impact range from the lowest minimum upwards with no gap and
 * no overlap, and only the top band is open-ended. A band below the top that gives no
 * {@code max_impact} ends where the next band starts.
 */
@Slf4j
@Service
public class ThresholdService {

    private final ThresholdRepository thresholdRepo;
    private final AtomicLong sequence = new AtomicLong();

    public ThresholdService(ThresholdRepository thresholdRepo) {
        this.thresholdRepo = thresholdRepo;
    }

    public List<RiskAppetiteThreshold> list(String orgId) {
        return sorted(thresholdRepo.findByOrg(orgId));
    }

    public synchronized List<RiskAppetiteThreshold> replaceAll(String orgId, List<ThresholdRequest> requests) {
        List<RiskAppetiteThreshold> candidate = new ArrayList<>();
        for (ThresholdRequest r : requests) {
            candidate.add(toThreshold(r));
        }
        return store(orgId, candidate);
    }

    public synchronized List<RiskAppetiteThreshold> add(String orgId, ThresholdRequest request) {
        List<RiskAppetiteThreshold> candidate = new ArrayList<>(thresholdRepo.findByOrg(orgId));
        candidate.add(toThreshold(request));
        return store(orgId, candidate);
    }

    public synchronized List<RiskAppetiteThreshold> delete(String orgId, String thresholdId) {
        List<RiskAppetiteThreshold> candidate = new ArrayList<>(thresholdRepo.findByOrg(orgId));
        if (!candidate.removeIf(t -> t.thresholdId().equals(thresholdId))) {
            throw new UnknownReferenceException("threshold", thresholdId);
        }
        return store(orgId, candidate);
    }

    public static void validate(List<RiskAppetiteThreshold> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new ConfigurationException("Risk appetite needs at least one threshold");
        }
        for (RiskAppetiteThreshold t : thresholds) {
            if (Double.isNaN(t.minImpact()) || Double.isInfinite(t.minImpact()) || t.minImpact() < 0) {
                throw new ConfigurationException("min_impact must be a non-negative amount");
            }
            if (t.maxImpact() != null && !(t.maxImpact() > t.minImpact())) {
                throw new ConfigurationException("max_impact must be greater than min_impact (" + t.minImpact() + ")");
            }
            if (t.route().isEmpty()) {
                throw new ConfigurationException("Threshold starting at " + t.minImpact() + " has no route");
            }
            if (t.route().contains(StakeholderRole.AUTO_RESOLVED) && t.route().size() > 1) {
                throw new ConfigurationException("AUTO_RESOLVED cannot be combined with human stakeholders");
            }
            if (t.slaMinutes() < 0) {
                throw new ConfigurationException("sla_minutes must be >= 0");
            }
        }

        List<RiskAppetiteThreshold> ordered = sorted(thresholds);
        for (int i = 1; i < ordered.size(); i++) {
            RiskAppetiteThreshold prev = ordered.get(i - 1);
            RiskAppetiteThreshold cur = ordered.get(i);
            if (prev.maxImpact() == null || prev.maxImpact() > cur.minImpact()) {
                throw new ConfigurationException("Thresholds overlap at " + cur.minImpact());
            }
            if (prev.maxImpact() < cur.minImpact()) {
                throw new ConfigurationException("Gap between " + prev.maxImpact() + " and " + cur.minImpact());
            }
        }
        if (ordered.get(ordered.size() - 1).maxImpact() != null) {
            throw new ConfigurationException("The highest threshold must be open-ended (no max_impact)");
        }
    }

    private List<RiskAppetiteThreshold> store(String orgId, List<RiskAppetiteThreshold> candidate) {
        List<RiskAppetiteThreshold> ordered = closeImpliedBands(sorted(candidate));
        validate(ordered);
        thresholdRepo.replace(orgId, ordered);
        log.info("Risk appetite for org {} now has {} bands", orgId, ordered.size());
        return ordered;
    }

    /** Expects bands ordered by minimum. Only a missing maximum is filled in; explicit ones are kept. */
    static List<RiskAppetiteThreshold> closeImpliedBands(List<RiskAppetiteThreshold> ordered) {
        List<RiskAppetiteThreshold> out = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            RiskAppetiteThreshold t = ordered.get(i);
            if (t.maxImpact() == null && i < ordered.size() - 1) {
                double nextMin = ordered.get(i + 1).minImpact();
                if (nextMin == t.minImpact()) {
                    throw new ConfigurationException("Thresholds overlap at " + nextMin);
                }
                t = new RiskAppetiteThreshold(t.thresholdId(), t.minImpact(), nextMin, t.route(), t.slaMinutes());
            }
            out.add(t);
        }
        return out;
    }

    private RiskAppetiteThreshold toThreshold(ThresholdRequest r) {
        if (r.min_impact() == null || r.sla_minutes() == null) {
            throw new ConfigurationException("min_impact and sla_minutes are required");
        }
        String id = String.format("TH-%04d", sequence.incrementAndGet());
        return new RiskAppetiteThreshold(id, r.min_impact(), r.max_impact(), r.route(), r.sla_minutes());
    }

    private static List<RiskAppetiteThreshold> sorted(List<RiskAppetiteThreshold> thresholds) {
        List<RiskAppetiteThreshold> copy = new ArrayList<>(thresholds);
        copy.sort(Comparator.comparingDouble(RiskAppetiteThreshold::minImpact));
        return copy;
    }
}
