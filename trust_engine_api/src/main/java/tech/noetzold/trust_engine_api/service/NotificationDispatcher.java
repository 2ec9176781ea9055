package tech.noetzold.trust_engine_api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import tech.noetzold.trust_engine_api.exception.NotificationFailedException;
import tech.noetzold.trust_engine_api.model.IncidentState;
import tech.noetzold.trust_engine_api.model.NotificationStatus;
import tech.noetzold.trust_engine_api.model.RoutingDecision;
import tech.noetzold.trust_engine_api.repository.IncidentStateRepository;

import java.util.concurrent.CompletableFuture;

/**
 * Sends routing decisions to stakeholders off the request thread and records the
 * delivery result on the incident. A failed delivery never touches the decision.
 */
@Service
public class NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final StakeholderNotificationClient client;
    private final IncidentStateRepository incidentRepo;

    public NotificationDispatcher(StakeholderNotificationClient client, IncidentStateRepository incidentRepo) {
        this.client = client;
        this.incidentRepo = incidentRepo;
    }

    @Async("taskExecutor")
    public CompletableFuture<NotificationStatus> dispatch(RoutingDecision decision) {
        NotificationStatus status;
        String error = null;
        try {
            client.notifyStakeholders(decision);
            status = NotificationStatus.DELIVERED;
        } catch (NotificationFailedException e) {
            logger.error("Routing decision {} for incident {} stays valid but was not delivered: {}",
                    decision.decisionId(), decision.incidentId(), e.getMessage());
            status = NotificationStatus.NOTIFICATION_FAILED;
            error = e.getMessage();
        }
        record(decision, status, error);
        return CompletableFuture.completedFuture(status);
    }

    private void record(RoutingDecision decision, NotificationStatus status, String error) {
        incidentRepo.update(decision.orgId(), decision.incidentId(), state -> applies(state, decision)
                ? state.withNotification(status, error)
                : state);
    }

    // a newer decision may have superseded this one while delivery was in flight
    private boolean applies(IncidentState state, RoutingDecision decision) {
        return decision.decisionId().equals(state.activeDecisionId());
    }
}
