package tech.noetzold.trust_engine_api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.trust_engine_api.model.RoutingDecision;
import tech.noetzold.trust_engine_api.model.RoutingDecisionRecord;
import tech.noetzold.trust_engine_api.repository.RoutingDecisionRecordRepository;

import java.util.List;

/**
 * Mirrors issued routing decisions into the relational audit table. Best effort:
 * a persistence failure is logged and never fails routing.
 */
@Slf4j
@Service
public class DecisionAuditService {

    private final RoutingDecisionRecordRepository recordRepo;
    private final ObjectMapper objectMapper;

    public DecisionAuditService(RoutingDecisionRecordRepository recordRepo, ObjectMapper objectMapper) {
        this.recordRepo = recordRepo;
        this.objectMapper = objectMapper;
    }

    // no surrounding transaction: save() opens its own
    public void record(RoutingDecision decision) {
        try {
            RoutingDecisionRecord rec = RoutingDecisionRecord.builder()
                    .decisionId(decision.decisionId())
                    .orgId(decision.orgId())
                    .incidentId(decision.incidentId())
                    .outcome(decision.outcome().name())
                    .estimatedImpact(decision.estimatedImpact())
                    .exceptionApplied(decision.exceptionApplied())
                    .decisionJson(objectMapper.valueToTree(decision))
                    .createdAt(decision.routedAt())
                    .build();
            recordRepo.save(rec);
            log.debug("RoutingDecisionRecord saved for decision {}", decision.decisionId());
        } catch (Exception e) {
            log.warn("Error to persist RoutingDecisionRecord {}", decision.decisionId(), e);
        }
    }

    public List<RoutingDecisionRecord> auditTrail(String orgId, String incidentId) {
        return recordRepo.findByOrgIdAndIncidentIdOrderByCreatedAtAsc(orgId, incidentId);
    }
}
