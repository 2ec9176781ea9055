package tech.noetzold.trust_engine_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.ExceptionPattern;
import tech.noetzold.trust_engine_api.repository.ExceptionPatternRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryExceptionPatternRepository implements ExceptionPatternRepository {

    private final Map<String, ExceptionPattern> db = new ConcurrentHashMap<>();

    @Override
    public ExceptionPattern save(ExceptionPattern pattern) {
        db.put(key(pattern.orgId(), pattern.patternId()), pattern);
        return pattern;
    }

    @Override
    public List<ExceptionPattern> findByOrg(String orgId) {
        return db.values().stream()
                .filter(p -> p.orgId().equals(orgId))
                .sorted(Comparator.comparing(ExceptionPattern::patternId))
                .toList();
    }

    @Override
    public Optional<ExceptionPattern> findById(String orgId, String patternId) {
        return Optional.ofNullable(db.get(key(orgId, patternId)));
    }

    @Override
    public ExceptionPattern update(String orgId, String patternId, UnaryOperator<ExceptionPattern> change) {
        ExceptionPattern updated = db.computeIfPresent(key(orgId, patternId), (k, p) -> change.apply(p));
        if (updated == null) {
            throw new UnknownReferenceException("exception pattern", patternId);
        }
        return updated;
    }

    private static String key(String orgId, String patternId) {
        return orgId + "/" + patternId;
    }
}
