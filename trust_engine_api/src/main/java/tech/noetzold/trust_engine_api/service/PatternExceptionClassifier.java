package tech.noetzold.trust_engine_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.trust_engine_api.exception.ConfigurationException;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.ExceptionMatch;
import tech.noetzold.trust_engine_api.model.ExceptionPattern;
import tech.noetzold.trust_engine_api.model.ExceptionPatternRequest;
import tech.noetzold.trust_engine_api.repository.ExceptionPatternRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tag-pattern classifier whose confidence is learned from reviewer feedback on
 * past overrides. Among matching patterns the most confident wins, then the most
 * specific, then the oldest.
 */
@Slf4j
@Component
public class PatternExceptionClassifier implements ExceptionClassifier {

    private static final Comparator<ExceptionPattern> PREFERENCE = Comparator
            .comparingDouble(ExceptionPattern::confidence).reversed()
            .thenComparing(Comparator.comparingInt((ExceptionPattern p) -> p.requiredTags().size()).reversed())
            .thenComparing(ExceptionPattern::patternId);

    private final ExceptionPatternRepository patternRepo;
    private final AtomicLong sequence = new AtomicLong();

    public PatternExceptionClassifier(ExceptionPatternRepository patternRepo) {
        this.patternRepo = patternRepo;
    }

    @Override
    public Optional<ExceptionMatch> classify(String orgId, String category, Set<String> contextTags) {
        SortedSet<String> tags = RiskImpactModel.normalizeTags(contextTags);
        return patternRepo.findByOrg(orgId).stream()
                .filter(p -> p.matches(category, tags))
                .min(PREFERENCE)
                .map(p -> new ExceptionMatch(p.patternId(), p.route(), p.slaMinutes(), p.confidence()));
    }

    public ExceptionPattern register(String orgId, ExceptionPatternRequest req) {
        SortedSet<String> tags = RiskImpactModel.normalizeTags(req.required_tags());
        if (tags.isEmpty()) {
            throw new ConfigurationException("An exception pattern needs at least one required tag");
        }
        if (req.route() == null || req.route().isEmpty()) {
            throw new ConfigurationException("An exception pattern needs a route");
        }
        if (req.sla_minutes() == null || req.sla_minutes() < 0) {
            throw new ConfigurationException("sla_minutes must be >= 0");
        }
        String id = String.format("EXP-%04d", sequence.incrementAndGet());
        ExceptionPattern pattern = new ExceptionPattern(id, orgId, req.category(), tags,
                req.route(), req.sla_minutes(), 0, 0);
        log.info("Exception pattern {} registered for org {}: tags={} route={}", id, orgId, tags, req.route());
        return patternRepo.save(pattern);
    }

    /** Records whether an applied override turned out to be the right call. */
    public ExceptionPattern recordFeedback(String orgId, String patternId, boolean overrideCorrect) {
        ExceptionPattern updated = patternRepo.update(orgId, patternId, p -> p.withFeedback(overrideCorrect));
        log.info("Exception pattern {} feedback={} -> confidence {}", patternId, overrideCorrect,
                String.format("%.3f", updated.confidence()));
        return updated;
    }

    public List<ExceptionPattern> patterns(String orgId) {
        return patternRepo.findByOrg(orgId);
    }

    public ExceptionPattern pattern(String orgId, String patternId) {
        return patternRepo.findById(orgId, patternId)
                .orElseThrow(() -> new UnknownReferenceException("exception pattern", patternId));
    }
}
