package tech.noetzold.trust_engine_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tech.noetzold.trust_engine_api.model.IncidentState;
import tech.noetzold.trust_engine_api.model.RoutingDecision;
import tech.noetzold.trust_engine_api.model.SlaBreach;
import tech.noetzold.trust_engine_api.repository.IncidentStateRepository;
import tech.noetzold.trust_engine_api.repository.RoutingDecisionRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reports SLA breaches. Deadlines are never moved; an overdue incident is flagged
 * once and stays in the breach report until it is acknowledged.
 */
@Slf4j
@Service
public class SlaMonitor {

    private final IncidentStateRepository incidentRepo;
    private final RoutingDecisionRepository decisionRepo;
    private final Clock clock;

    public SlaMonitor(IncidentStateRepository incidentRepo, RoutingDecisionRepository decisionRepo, Clock clock) {
        this.incidentRepo = incidentRepo;
        this.decisionRepo = decisionRepo;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${trust-engine.sla.scan-interval-ms:60000}")
    public void scan() {
        Instant now = clock.instant();
        for (IncidentState state : incidentRepo.findAwaitingAcknowledgement()) {
            if (state.slaBreached()) continue;
            overdue(state, now).ifPresent(decision -> {
                incidentRepo.update(state.orgId(), state.incidentId(), IncidentState::withSlaBreached);
                log.warn("SLA breached: incident {} for org {} routed to {} was due at {}",
                        state.incidentId(), state.orgId(), decision.route(), decision.slaDeadline());
            });
        }
    }

    public List<SlaBreach> breaches(String orgId) {
        Instant now = clock.instant();
        List<SlaBreach> out = new ArrayList<>();
        for (IncidentState state : incidentRepo.findByOrg(orgId)) {
            Optional<RoutingDecision> decision = state.awaitingAcknowledgement()
                    ? overdue(state, now)
                    : state.slaBreached() ? active(state) : Optional.empty();
            decision.ifPresent(d -> {
                Instant reference = state.acknowledgedAt() != null ? state.acknowledgedAt() : now;
                long overdueMinutes = Math.max(0, Duration.between(d.slaDeadline(), reference).toMinutes());
                out.add(new SlaBreach(state.incidentId(), d.decisionId(), d.route(), d.slaDeadline(),
                        overdueMinutes, state.state()));
            });
        }
        out.sort(Comparator.comparing(SlaBreach::slaDeadline));
        return out;
    }

    private Optional<RoutingDecision> overdue(IncidentState state, Instant now) {
        return active(state).filter(d -> d.slaDeadline() != null && now.isAfter(d.slaDeadline()));
    }

    private Optional<RoutingDecision> active(IncidentState state) {
        return decisionRepo.findById(state.orgId(), state.activeDecisionId());
    }
}
