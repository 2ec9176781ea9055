package tech.noetzold.trust_engine_api.controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import tech.noetzold.trust_engine_api.TraceIdFilter;
import tech.noetzold.trust_engine_api.exception.StatusConflictException;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.*;
import tech.noetzold.trust_engine_api.service.DecisionAuditService;
import tech.noetzold.trust_engine_api.service.RoutingEngine;
import tech.noetzold.trust_engine_api.service.SlaMonitor;

import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class FindingControllerTest {

    @Mock private RoutingEngine routingEngine;
    @Mock private SlaMonitor slaMonitor;
    @Mock private DecisionAuditService auditService;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new FindingController(routingEngine, slaMonitor, auditService))
                .setControllerAdvice(new ErrorHandler())
                .addFilters(new TraceIdFilter())
                .build();
    }

    @Test
    void submitReturnsTheRoutingDecision() throws Exception {
        RoutingDecision decision = RoutingDecision.builder()
                .decisionId("dec_1")
                .orgId("acme")
                .incidentId("INC-1")
                .category("Data Exposure")
                .contextTags(new TreeSet<>())
                .estimatedImpact(2_800_000.0)
                .route(List.of(StakeholderRole.CEO, StakeholderRole.CISO))
                .slaMinutes(60)
                .outcome(RoutingOutcome.ROUTED)
                .routedAt(Instant.parse("2026-03-01T09:00:00Z"))
                .build();
        when(routingEngine.submitFinding(eq("acme"), any(FindingRequest.class))).thenReturn(decision);

        mvc.perform(post("/organizations/acme/findings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"incident_id\":\"INC-1\",\"category\":\"Data Exposure\",\"context_tags\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.decision_id").value("dec_1"))
                .andExpect(jsonPath("$.route", contains("CEO", "CISO")))
                .andExpect(jsonPath("$.estimated_impact").value(2_800_000.0))
                .andExpect(jsonPath("$.outcome").value("ROUTED"));
    }

    @Test
    void blankCategoryIsAnInvalidRequest() throws Exception {
        mvc.perform(post("/organizations/acme/findings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.message", containsString("category")));
        verifyNoInteractions(routingEngine);
    }

    @Test
    void unknownCategoryIsNotFoundAndCarriesTheTraceId() throws Exception {
        when(routingEngine.submitFinding(eq("acme"), any(FindingRequest.class)))
                .thenThrow(new UnknownReferenceException("risk category", "Alien Invasion"));

        mvc.perform(post("/organizations/acme/findings")
                        .header(TraceIdFilter.HEADER, "trc-test-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"category\":\"Alien Invasion\"}"))
                .andExpect(status().isNotFound())
                .andExpect(header().string(TraceIdFilter.HEADER, "trc-test-1"))
                .andExpect(jsonPath("$.code").value("UNKNOWN_REFERENCE"))
                .andExpect(jsonPath("$.reference").value("Alien Invasion"))
                .andExpect(jsonPath("$.trace_id").value("trc-test-1"));
    }

    @Test
    void acknowledgingTwiceConflicts() throws Exception {
        when(routingEngine.acknowledge("acme", "INC-1"))
                .thenThrow(new StatusConflictException("incident INC-1 cannot move from ACKNOWLEDGED to ACKNOWLEDGED"));

        mvc.perform(post("/organizations/acme/findings/INC-1/acknowledge"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("STATUS_CONFLICT"));
    }

    @Test
    void slaBreachesAreListed() throws Exception {
        when(slaMonitor.breaches("acme")).thenReturn(List.of(new SlaBreach("INC-1", "dec_1",
                List.of(StakeholderRole.CEO), Instant.parse("2026-03-01T10:00:00Z"), 15, IncidentLifecycle.ROUTED)));

        mvc.perform(get("/organizations/acme/sla-breaches"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].incident_id").value("INC-1"))
                .andExpect(jsonPath("$[0].overdue_minutes").value(15));
    }
}
