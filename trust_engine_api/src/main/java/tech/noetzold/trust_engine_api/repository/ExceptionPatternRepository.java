package tech.noetzold.trust_engine_api.repository;

import tech.noetzold.trust_engine_api.model.ExceptionPattern;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface ExceptionPatternRepository {
    ExceptionPattern save(ExceptionPattern pattern);

    List<ExceptionPattern> findByOrg(String orgId);

    Optional<ExceptionPattern> findById(String orgId, String patternId);

    ExceptionPattern update(String orgId, String patternId, UnaryOperator<ExceptionPattern> change);
}
