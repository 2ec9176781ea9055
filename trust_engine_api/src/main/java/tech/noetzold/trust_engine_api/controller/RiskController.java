package tech.noetzold.trust_engine_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.trust_engine_api.model.ImpactEstimate;
import tech.noetzold.trust_engine_api.model.ImpactEstimateRequest;
import tech.noetzold.trust_engine_api.model.RemediationPlanRequest;
import tech.noetzold.trust_engine_api.model.RemediationPriority;
import tech.noetzold.trust_engine_api.model.RiskImpactEntry;
import tech.noetzold.trust_engine_api.service.RiskImpactModel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/risk")
@Tag(name = "Risk")
public class RiskController {

    private final RiskImpactModel impactModel;

    public RiskController(RiskImpactModel impactModel) {
        this.impactModel = impactModel;
    }

    @GetMapping("/priority/{category}")
    public Map<String, Object> priority(@PathVariable String category) {
        RiskImpactEntry entry = impactModel.entry(category);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", entry.category());
        body.put("likelihood", entry.likelihood());
        body.put("average_incident_cost", entry.averageIncidentCost());
        body.put("complexity_to_remediate", entry.complexityToRemediate());
        body.put("priority_score", entry.priorityScore());
        return body;
    }

    @PostMapping("/estimate")
    public ImpactEstimate estimate(@Valid @RequestBody ImpactEstimateRequest req) {
        return impactModel.estimateImpact(req.category(), req.context_tags());
    }

    @PostMapping("/remediation-plan")
    public List<RemediationPriority> remediationPlan(@RequestBody(required = false) RemediationPlanRequest req) {
        return impactModel.rankRemediation(req != null ? req.categories() : null);
    }
}
