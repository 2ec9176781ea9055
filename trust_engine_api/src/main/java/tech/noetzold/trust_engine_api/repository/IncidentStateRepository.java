package tech.noetzold.trust_engine_api.repository;

import tech.noetzold.trust_engine_api.model.IncidentState;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface IncidentStateRepository {
    Optional<IncidentState> find(String orgId, String incidentId);

    IncidentState save(IncidentState state);

    /** Applies {@code change} atomically to the stored state of the incident. */
    IncidentState update(String orgId, String incidentId, UnaryOperator<IncidentState> change);

    List<IncidentState> findByOrg(String orgId);

    List<IncidentState> findAwaitingAcknowledgement();
}
