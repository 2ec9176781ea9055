package tech.noetzold.trust_engine_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.noetzold.trust_engine_api.exception.NotificationFailedException;
import tech.noetzold.trust_engine_api.model.*;
import tech.noetzold.trust_engine_api.repository.impl.InMemoryIncidentStateRepository;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock private StakeholderNotificationClient client;

    private InMemoryIncidentStateRepository incidentRepo;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        incidentRepo = new InMemoryIncidentStateRepository();
        dispatcher = new NotificationDispatcher(client, incidentRepo);
    }

    private RoutingDecision routed(String decisionId) {
        RoutingDecision decision = RoutingDecision.builder()
                .decisionId(decisionId)
                .orgId("acme")
                .incidentId("INC-1")
                .category("Data Exposure")
                .route(List.of(StakeholderRole.CEO, StakeholderRole.CISO))
                .slaMinutes(60)
                .outcome(RoutingOutcome.ROUTED)
                .routedAt(NOW)
                .build();
        incidentRepo.save(IncidentState.received("acme", "INC-1", NOW)
                .withDecision(decisionId, NotificationStatus.PENDING));
        return decision;
    }

    @Test
    void successfulDeliveryIsRecorded() throws Exception {
        RoutingDecision decision = routed("dec_1");

        assertThat(dispatcher.dispatch(decision).get()).isEqualTo(NotificationStatus.DELIVERED);
        assertThat(incidentRepo.find("acme", "INC-1").orElseThrow().notificationStatus())
                .isEqualTo(NotificationStatus.DELIVERED);
    }

    @Test
    void failedDeliveryKeepsTheDecisionActive() throws Exception {
        RoutingDecision decision = routed("dec_1");
        doThrow(new NotificationFailedException("gateway down", 3, null)).when(client).notifyStakeholders(decision);

        assertThat(dispatcher.dispatch(decision).get()).isEqualTo(NotificationStatus.NOTIFICATION_FAILED);

        IncidentState state = incidentRepo.find("acme", "INC-1").orElseThrow();
        assertThat(state.notificationStatus()).isEqualTo(NotificationStatus.NOTIFICATION_FAILED);
        assertThat(state.notificationError()).contains("gateway down");
        assertThat(state.activeDecisionId()).isEqualTo("dec_1");
    }

    @Test
    void resultForASupersededDecisionIsDropped() throws Exception {
        RoutingDecision stale = routed("dec_1");
        incidentRepo.update("acme", "INC-1", s -> s.withDecision("dec_2", NotificationStatus.PENDING));

        dispatcher.dispatch(stale).get();

        assertThat(incidentRepo.find("acme", "INC-1").orElseThrow().notificationStatus())
                .isEqualTo(NotificationStatus.PENDING);
    }
}
