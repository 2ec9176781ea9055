package tech.noetzold.trust_engine_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.trust_engine_api.model.FindingRequest;
import tech.noetzold.trust_engine_api.model.IncidentState;
import tech.noetzold.trust_engine_api.model.IncidentView;
import tech.noetzold.trust_engine_api.model.RoutingDecision;
import tech.noetzold.trust_engine_api.model.RoutingDecisionRecord;
import tech.noetzold.trust_engine_api.model.SlaBreach;
import tech.noetzold.trust_engine_api.service.DecisionAuditService;
import tech.noetzold.trust_engine_api.service.RoutingEngine;
import tech.noetzold.trust_engine_api.service.SlaMonitor;

import java.util.List;

@RestController
@RequestMapping("/organizations/{orgId}")
@Tag(name = "Routing")
public class FindingController {

    private final RoutingEngine routingEngine;
    private final SlaMonitor slaMonitor;
    private final DecisionAuditService auditService;

    public FindingController(RoutingEngine routingEngine, SlaMonitor slaMonitor, DecisionAuditService auditService) {
        this.routingEngine = routingEngine;
        this.slaMonitor = slaMonitor;
        this.auditService = auditService;
    }

    @PostMapping("/findings")
    @Operation(summary = "Score a finding and route it to the stakeholders its impact calls for")
    public RoutingDecision submit(@PathVariable String orgId, @Valid @RequestBody FindingRequest req) {
        return routingEngine.submitFinding(orgId, req);
    }

    @GetMapping("/findings/{incidentId}")
    public IncidentView incident(@PathVariable String orgId, @PathVariable String incidentId) {
        return routingEngine.incident(orgId, incidentId);
    }

    @GetMapping("/findings/{incidentId}/audit")
    public List<RoutingDecisionRecord> audit(@PathVariable String orgId, @PathVariable String incidentId) {
        return auditService.auditTrail(orgId, incidentId);
    }

    @PostMapping("/findings/{incidentId}/acknowledge")
    public IncidentState acknowledge(@PathVariable String orgId, @PathVariable String incidentId) {
        return routingEngine.acknowledge(orgId, incidentId);
    }

    @PostMapping("/findings/{incidentId}/escalate")
    public RoutingDecision escalate(@PathVariable String orgId, @PathVariable String incidentId) {
        return routingEngine.escalate(orgId, incidentId);
    }

    @PostMapping("/findings/{incidentId}/reevaluate")
    public RoutingDecision reevaluate(@PathVariable String orgId, @PathVariable String incidentId) {
        return routingEngine.reevaluate(orgId, incidentId);
    }

    @GetMapping("/sla-breaches")
    public List<SlaBreach> slaBreaches(@PathVariable String orgId) {
        return slaMonitor.breaches(orgId);
    }
}
