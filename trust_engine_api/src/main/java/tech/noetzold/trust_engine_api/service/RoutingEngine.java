package tech.noetzold.trust_engine_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.trust_engine_api.exception.StatusConflictException;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.*;
import tech.noetzold.trust_engine_api.repository.IncidentStateRepository;
import tech.noetzold.trust_engine_api.repository.RoutingDecisionRepository;
import tech.noetzold.trust_engine_api.repository.ThresholdRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * CLEARANCE routing: scores a finding, picks the stakeholder route from the
 * organization's risk appetite bands, lets a confident exception pattern override it,
 * and tracks the incident through acknowledgement or escalation.
 *
 * <p>All work on one incident runs under that incident's lock, so concurrent retries
 * of the same finding cannot issue two active decisions.
 */
@Slf4j
@Service
public class RoutingEngine {

    private final RiskImpactModel impactModel;
    private final ThresholdRepository thresholdRepo;
    private final ExceptionClassifier exceptionClassifier;
    private final RoutingDecisionRepository decisionRepo;
    private final IncidentStateRepository incidentRepo;
    private final NotificationDispatcher dispatcher;
    private final DecisionAuditService auditService;
    private final Clock clock;
    private final double exceptionCutoff;
    private final int triageSlaMinutes;
    private final Duration lockTimeout;

    private final Map<String, ReentrantLock> incidentLocks = new ConcurrentHashMap<>();

    public RoutingEngine(RiskImpactModel impactModel,
                         ThresholdRepository thresholdRepo,
                         ExceptionClassifier exceptionClassifier,
                         RoutingDecisionRepository decisionRepo,
                         IncidentStateRepository incidentRepo,
                         NotificationDispatcher dispatcher,
                         DecisionAuditService auditService,
                         Clock clock,
                         @Value("${trust-engine.routing.exception-cutoff:0.8}") double exceptionCutoff,
                         @Value("${trust-engine.routing.triage-sla-minutes:60}") int triageSlaMinutes,
                         @Value("${trust-engine.routing.lock-timeout-ms:5000}") long lockTimeoutMs) {
        this.impactModel = impactModel;
        this.thresholdRepo = thresholdRepo;
        this.exceptionClassifier = exceptionClassifier;
        this.decisionRepo = decisionRepo;
        this.incidentRepo = incidentRepo;
        this.dispatcher = dispatcher;
        this.auditService = auditService;
        this.clock = clock;
        this.exceptionCutoff = exceptionCutoff;
        this.triageSlaMinutes = triageSlaMinutes;
        this.lockTimeout = Duration.ofMillis(lockTimeoutMs);
    }

    public RoutingDecision submitFinding(String orgId, FindingRequest req) {
        String incidentId = (req.incident_id() != null && !req.incident_id().isBlank())
                ? req.incident_id()
                : "inc_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
        SortedSet<String> tags = RiskImpactModel.normalizeTags(req.context_tags());

        return withIncidentLock(orgId, incidentId, () -> {
            Optional<RoutingDecision> active = incidentRepo.find(orgId, incidentId)
                    .map(IncidentState::activeDecisionId)
                    .flatMap(id -> decisionRepo.findById(orgId, id));
            if (active.isPresent()) {
                log.info("Incident {} for org {} already routed by {}, returning it", incidentId, orgId,
                        active.get().decisionId());
                return active.get();
            }
            // unknown categories are rejected before the incident is recorded
            ImpactEstimate estimate = impactModel.estimateImpact(req.category(), tags);
            incidentRepo.save(IncidentState.received(orgId, incidentId, clock.instant()));
            return evaluate(orgId, incidentId, estimate, tags, null);
        });
    }

    /** Issues a fresh decision for the incident; the previous one stays in the audit trail. */
    public RoutingDecision reevaluate(String orgId, String incidentId) {
        return withIncidentLock(orgId, incidentId, () -> {
            RoutingDecision prior = activeDecision(orgId, incidentId);
            ImpactEstimate estimate = impactModel.estimateImpact(prior.category(), prior.contextTags());
            incidentRepo.update(orgId, incidentId, s -> s.restart(clock.instant(), "re-evaluation of " + prior.decisionId()));
            return evaluate(orgId, incidentId, estimate, prior.contextTags(), prior.decisionId());
        });
    }

    public IncidentState acknowledge(String orgId, String incidentId) {
        return withIncidentLock(orgId, incidentId, () -> {
            RoutingDecision decision = activeDecision(orgId, incidentId);
            Instant now = clock.instant();
            IncidentState state = transition(orgId, incidentId, IncidentLifecycle.ACKNOWLEDGED, now, "acknowledged");
            if (decision.slaDeadline() != null && now.isAfter(decision.slaDeadline())) {
                log.warn("Incident {} for org {} acknowledged {} min after its SLA deadline",
                        incidentId, orgId, Duration.between(decision.slaDeadline(), now).toMinutes());
                state = incidentRepo.update(orgId, incidentId, IncidentState::withSlaBreached);
            }
            return state;
        });
    }

    /**
     * Moves the incident one risk band up: the route gains the next band's stakeholders
     * and the deadline can only get earlier.
     */
    public RoutingDecision escalate(String orgId, String incidentId) {
        return withIncidentLock(orgId, incidentId, () -> {
            RoutingDecision current = activeDecision(orgId, incidentId);
            IncidentState state = incidentRepo.find(orgId, incidentId)
                    .orElseThrow(() -> new UnknownReferenceException("incident", incidentId));
            if (!state.state().canMoveTo(IncidentLifecycle.ESCALATED)) {
                throw new StatusConflictException("Incident " + incidentId + " cannot be escalated from " + state.state());
            }

            Instant now = clock.instant();
            Optional<RiskAppetiteThreshold> next = nextBandAbove(orgId, current.matchedThreshold());

            Set<StakeholderRole> route = new LinkedHashSet<>(current.route());
            int sla = current.slaMinutes();
            if (next.isPresent()) {
                next.get().route().stream()
                        .filter(r -> r != StakeholderRole.AUTO_RESOLVED)
                        .forEach(route::add);
                sla = Math.min(sla, next.get().slaMinutes());
            }
            route.remove(StakeholderRole.AUTO_RESOLVED);
            if (route.isEmpty()) {
                route.add(StakeholderRole.MANUAL_TRIAGE);
            }
            Instant deadline = now.plus(Duration.ofMinutes(sla));
            if (current.slaDeadline() != null && current.slaDeadline().isBefore(deadline)) {
                deadline = current.slaDeadline();
            }

            RoutingDecision escalated = current.toBuilder()
                    .decisionId(newDecisionId())
                    .matchedThreshold(next.orElse(current.matchedThreshold()))
                    .route(List.copyOf(route))
                    .slaMinutes(sla)
                    .outcome(RoutingOutcome.ROUTED)
                    .routedAt(now)
                    .slaDeadline(deadline)
                    .supersedesDecisionId(current.decisionId())
                    .build();
            issue(escalated);
            transition(orgId, incidentId, IncidentLifecycle.ESCALATED, now, "escalated to " + escalated.route());
            incidentRepo.update(orgId, incidentId, s -> s.withDecision(escalated.decisionId(), NotificationStatus.PENDING));
            dispatcher.dispatch(escalated);
            log.info("Incident {} for org {} escalated: {} -> {}", incidentId, orgId, current.route(), escalated.route());
            return escalated;
        });
    }

    public IncidentView incident(String orgId, String incidentId) {
        IncidentState state = incidentRepo.find(orgId, incidentId)
                .orElseThrow(() -> new UnknownReferenceException("incident", incidentId));
        RoutingDecision active = decisionRepo.findById(orgId, state.activeDecisionId()).orElse(null);
        return new IncidentView(state, active, decisionRepo.findByIncident(orgId, incidentId));
    }

    private RoutingDecision evaluate(String orgId,
                                     String incidentId,
                                     ImpactEstimate estimate,
                                     SortedSet<String> tags,
                                     String supersedes) {
        Instant now = clock.instant();
        double impact = estimate.estimatedImpact();
        transition(orgId, incidentId, IncidentLifecycle.SCORED, now, String.format("estimated impact %.2f", impact));

        List<RiskAppetiteThreshold> bands = descending(thresholdRepo.findByOrg(orgId));

        RiskAppetiteThreshold matched = null;
        List<StakeholderRole> route;
        int sla;
        RoutingOutcome outcome;
        boolean configurationError = false;

        if (bands.isEmpty()) {
            log.warn("Org {} has no risk appetite thresholds; incident {} sent to manual triage", orgId, incidentId);
            route = List.of(StakeholderRole.MANUAL_TRIAGE);
            sla = triageSlaMinutes;
            outcome = RoutingOutcome.MANUAL_TRIAGE;
            configurationError = true;
        } else {
            matched = bands.stream().filter(t -> t.minImpact() <= impact).findFirst().orElse(null);
            if (matched == null) {
                route = List.of(StakeholderRole.AUTO_RESOLVED);
                sla = 0;
                outcome = RoutingOutcome.AUTO_RESOLVED;
            } else {
                route = matched.route();
                sla = matched.slaMinutes();
                outcome = matched.isAutomatic() ? RoutingOutcome.AUTO_RESOLVED : RoutingOutcome.ROUTED;
            }
        }

        RoutingDecision.RoutingDecisionBuilder decision = RoutingDecision.builder()
                .decisionId(newDecisionId())
                .orgId(orgId)
                .incidentId(incidentId)
                .category(estimate.category())
                .contextTags(tags)
                .estimatedImpact(impact)
                .matchedThreshold(matched)
                .thresholdRoute(route)
                .configurationError(configurationError)
                .routedAt(now)
                .supersedesDecisionId(supersedes);

        Optional<ExceptionMatch> exception = configurationError
                ? Optional.empty()
                : exceptionClassifier.classify(orgId, estimate.category(), tags)
                    .filter(m -> m.confidence() >= exceptionCutoff);

        if (exception.isPresent()) {
            ExceptionMatch m = exception.get();
            log.info("Exception pattern {} (confidence {}) overrides route {} -> {} for incident {}",
                    m.patternId(), String.format("%.3f", m.confidence()), route, m.route(), incidentId);
            route = m.route();
            sla = m.slaMinutes();
            outcome = route.stream().allMatch(r -> r == StakeholderRole.AUTO_RESOLVED)
                    ? RoutingOutcome.AUTO_RESOLVED
                    : RoutingOutcome.ROUTED;
            decision.exceptionApplied(true).exceptionPatternId(m.patternId());
        }

        RoutingDecision issued = decision
                .route(route)
                .slaMinutes(sla)
                .outcome(outcome)
                .slaDeadline(now.plus(Duration.ofMinutes(sla)))
                .build();
        issue(issued);

        if (issued.outcome() == RoutingOutcome.AUTO_RESOLVED) {
            transition(orgId, incidentId, IncidentLifecycle.AUTO_RESOLVED, now, "below manual intervention threshold");
            incidentRepo.update(orgId, incidentId, s -> s.withDecision(issued.decisionId(), NotificationStatus.NOT_REQUIRED));
        } else {
            transition(orgId, incidentId, IncidentLifecycle.ROUTED, now, "routed to " + issued.route());
            incidentRepo.update(orgId, incidentId, s -> s.withDecision(issued.decisionId(), NotificationStatus.PENDING));
            dispatcher.dispatch(issued);
        }

        log.info("Incident {} for org {} routed: impact={} outcome={} route={} sla={}min",
                incidentId, orgId, String.format("%.2f", impact), issued.outcome(), issued.route(), issued.slaMinutes());
        return issued;
    }

    private void issue(RoutingDecision decision) {
        decisionRepo.append(decision);
        auditService.record(decision);
    }

    private IncidentState transition(String orgId, String incidentId, IncidentLifecycle target, Instant at, String note) {
        try {
            return incidentRepo.update(orgId, incidentId, s -> s.moveTo(target, at, note));
        } catch (IllegalStateException e) {
            throw new StatusConflictException(e.getMessage());
        }
    }

    private RoutingDecision activeDecision(String orgId, String incidentId) {
        return incidentRepo.find(orgId, incidentId)
                .map(IncidentState::activeDecisionId)
                .flatMap(id -> decisionRepo.findById(orgId, id))
                .orElseThrow(() -> new UnknownReferenceException("incident", incidentId));
    }

    private Optional<RiskAppetiteThreshold> nextBandAbove(String orgId, RiskAppetiteThreshold band) {
        double floor = band != null ? band.minImpact() : Double.NEGATIVE_INFINITY;
        return thresholdRepo.findByOrg(orgId).stream()
                .filter(t -> t.minImpact() > floor)
                .min(Comparator.comparingDouble(RiskAppetiteThreshold::minImpact));
    }

    private static List<RiskAppetiteThreshold> descending(List<RiskAppetiteThreshold> thresholds) {
        List<RiskAppetiteThreshold> copy = new ArrayList<>(thresholds);
        copy.sort(Comparator.comparingDouble(RiskAppetiteThreshold::minImpact).reversed());
        return copy;
    }

    private <T> T withIncidentLock(String orgId, String incidentId, Supplier<T> work) {
        ReentrantLock lock = incidentLocks.computeIfAbsent(orgId + "/" + incidentId, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StatusConflictException("Interrupted while waiting for incident " + incidentId);
        }
        if (!acquired) {
            throw new StatusConflictException("Incident " + incidentId + " is being routed by another request");
        }
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private String newDecisionId() {
        return "dec_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
