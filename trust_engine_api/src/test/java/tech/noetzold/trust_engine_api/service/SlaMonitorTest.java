package tech.noetzold.trust_engine_api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.noetzold.trust_engine_api.model.*;
import tech.noetzold.trust_engine_api.repository.impl.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static tech.noetzold.trust_engine_api.model.StakeholderRole.*;

class SlaMonitorTest {

    private static final Instant START = Instant.parse("2026-03-01T09:00:00Z");

    private MutableClock clock;
    private InMemoryIncidentStateRepository incidentRepo;
    private RoutingEngine engine;
    private SlaMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        InMemoryThresholdRepository thresholdRepo = new InMemoryThresholdRepository();
        new ThresholdService(thresholdRepo).replaceAll("acme", List.of(
                new ThresholdRequest(0.0, 500_000.0, List.of(AUTO_RESOLVED), 0),
                new ThresholdRequest(500_000.0, 2_000_000.0, List.of(SECURITY_TEAM), 240),
                new ThresholdRequest(2_000_000.0, null, List.of(CEO, CISO), 60)));
        InMemoryRoutingDecisionRepository decisionRepo = new InMemoryRoutingDecisionRepository();
        incidentRepo = new InMemoryIncidentStateRepository();

        engine = new RoutingEngine(
                new RiskImpactModel(new InMemoryRiskImpactRepository(), Map.of(), 3.0),
                thresholdRepo,
                new PatternExceptionClassifier(new InMemoryExceptionPatternRepository()),
                decisionRepo, incidentRepo,
                mock(NotificationDispatcher.class), mock(DecisionAuditService.class),
                clock, 0.8, 60, 5_000);
        monitor = new SlaMonitor(incidentRepo, decisionRepo, clock);
    }

    private void submit(String incidentId, String category) {
        engine.submitFinding("acme", new FindingRequest(incidentId, category, List.of()));
    }

    @Test
    void nothingIsReportedBeforeTheDeadline() {
        submit("INC-1", "Data Exposure");
        clock.advance(Duration.ofMinutes(59));

        monitor.scan();

        assertThat(monitor.breaches("acme")).isEmpty();
        assertThat(incidentRepo.find("acme", "INC-1").orElseThrow().slaBreached()).isFalse();
    }

    @Test
    void overdueIncidentIsFlaggedAndReported() {
        submit("INC-1", "Data Exposure");
        submit("INC-2", "Privilege Escalation");
        clock.advance(Duration.ofMinutes(75));

        monitor.scan();

        List<SlaBreach> breaches = monitor.breaches("acme");
        assertThat(breaches).singleElement().satisfies(b -> {
            assertThat(b.incidentId()).isEqualTo("INC-1");
            assertThat(b.route()).containsExactly(CEO, CISO);
            assertThat(b.overdueMinutes()).isEqualTo(15);
        });
        assertThat(incidentRepo.find("acme", "INC-1").orElseThrow().slaBreached()).isTrue();
        assertThat(incidentRepo.find("acme", "INC-2").orElseThrow().slaBreached()).isFalse();
    }

    @Test
    void lateAcknowledgementStaysOnTheReportWithItsFinalDelay() {
        submit("INC-1", "Data Exposure");
        clock.advance(Duration.ofMinutes(80));
        engine.acknowledge("acme", "INC-1");
        clock.advance(Duration.ofHours(5));

        assertThat(monitor.breaches("acme")).singleElement()
                .satisfies(b -> assertThat(b.overdueMinutes()).isEqualTo(20));
    }

    @Test
    void autoResolvedIncidentsNeverBreach() {
        submit("INC-1", "Misconfiguration");
        clock.advance(Duration.ofDays(3));

        monitor.scan();

        assertThat(monitor.breaches("acme")).isEmpty();
    }
}
