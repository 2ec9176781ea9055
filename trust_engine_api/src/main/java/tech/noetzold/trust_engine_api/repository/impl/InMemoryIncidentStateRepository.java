package tech.noetzold.trust_engine_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.IncidentState;
import tech.noetzold.trust_engine_api.repository.IncidentStateRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryIncidentStateRepository implements IncidentStateRepository {

    private final Map<String, IncidentState> db = new ConcurrentHashMap<>();

    @Override
    public Optional<IncidentState> find(String orgId, String incidentId) {
        return Optional.ofNullable(db.get(key(orgId, incidentId)));
    }

    @Override
    public IncidentState save(IncidentState state) {
        db.put(key(state.orgId(), state.incidentId()), state);
        return state;
    }

    @Override
    public IncidentState update(String orgId, String incidentId, UnaryOperator<IncidentState> change) {
        IncidentState updated = db.computeIfPresent(key(orgId, incidentId), (k, current) -> change.apply(current));
        if (updated == null) {
            throw new UnknownReferenceException("incident", incidentId);
        }
        return updated;
    }

    @Override
    public List<IncidentState> findByOrg(String orgId) {
        return db.values().stream()
                .filter(s -> s.orgId().equals(orgId))
                .sorted(Comparator.comparing(IncidentState::incidentId))
                .toList();
    }

    @Override
    public List<IncidentState> findAwaitingAcknowledgement() {
        return db.values().stream().filter(IncidentState::awaitingAcknowledgement).toList();
    }

    private static String key(String orgId, String incidentId) {
        return orgId + "/" + incidentId;
    }
}
