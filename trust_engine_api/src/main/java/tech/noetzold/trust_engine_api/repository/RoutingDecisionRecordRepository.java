package tech.noetzold.trust_engine_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.trust_engine_api.model.RoutingDecisionRecord;

import java.util.List;

public interface RoutingDecisionRecordRepository extends JpaRepository<RoutingDecisionRecord, Long> {
    List<RoutingDecisionRecord> findByOrgIdAndIncidentIdOrderByCreatedAtAsc(String orgId, String incidentId);
}
