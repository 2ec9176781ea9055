package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Lifecycle of one incident. Every change yields a new instance with the
 * transition appended to {@code history}.
 */
public record IncidentState(
        @JsonProperty("org_id") String orgId,
        @JsonProperty("incident_id") String incidentId,
        IncidentLifecycle state,
        @JsonProperty("active_decision_id") String activeDecisionId,
        @JsonProperty("notification_status") NotificationStatus notificationStatus,
        @JsonProperty("notification_error") String notificationError,
        @JsonProperty("sla_breached") boolean slaBreached,
        @JsonProperty("acknowledged_at") Instant acknowledgedAt,
        List<Transition> history
) {
    public record Transition(IncidentLifecycle from, IncidentLifecycle to, Instant at, String note) {}

    public IncidentState {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static IncidentState received(String orgId, String incidentId, Instant at) {
        return new IncidentState(orgId, incidentId, IncidentLifecycle.RECEIVED, null,
                NotificationStatus.NOT_REQUIRED, null, false, null,
                List.of(new Transition(null, IncidentLifecycle.RECEIVED, at, "finding received")));
    }

    /** Starts a fresh evaluation cycle, keeping the earlier transitions. */
    public IncidentState restart(Instant at, String note) {
        List<Transition> h = new ArrayList<>(history);
        h.add(new Transition(state, IncidentLifecycle.RECEIVED, at, note));
        return new IncidentState(orgId, incidentId, IncidentLifecycle.RECEIVED, activeDecisionId,
                notificationStatus, notificationError, false, null, h);
    }

    public IncidentState moveTo(IncidentLifecycle target, Instant at, String note) {
        if (!state.canMoveTo(target)) {
            throw new IllegalStateException("incident " + incidentId + " cannot move from " + state + " to " + target);
        }
        List<Transition> h = new ArrayList<>(history);
        h.add(new Transition(state, target, at, note));
        Instant ack = target == IncidentLifecycle.ACKNOWLEDGED ? at : acknowledgedAt;
        return new IncidentState(orgId, incidentId, target, activeDecisionId, notificationStatus,
                notificationError, slaBreached, ack, h);
    }

    public IncidentState withDecision(String decisionId, NotificationStatus notification) {
        return new IncidentState(orgId, incidentId, state, decisionId, notification, null,
                false, acknowledgedAt, history);
    }

    public IncidentState withNotification(NotificationStatus status, String error) {
        return new IncidentState(orgId, incidentId, state, activeDecisionId, status, error,
                slaBreached, acknowledgedAt, history);
    }

    public IncidentState withSlaBreached() {
        return new IncidentState(orgId, incidentId, state, activeDecisionId, notificationStatus,
                notificationError, true, acknowledgedAt, history);
    }

    public boolean awaitingAcknowledgement() {
        return state == IncidentLifecycle.ROUTED || state == IncidentLifecycle.ESCALATED;
    }
}
