package tech.noetzold.trust_engine_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.trust_engine_api.model.RiskAppetiteThreshold;
import tech.noetzold.trust_engine_api.model.ThresholdRequest;
import tech.noetzold.trust_engine_api.service.ThresholdService;

import java.util.List;

@RestController
@RequestMapping("/organizations/{orgId}/thresholds")
@Tag(name = "Routing")
public class ThresholdController {

    private final ThresholdService thresholdService;

    public ThresholdController(ThresholdService thresholdService) {
        this.thresholdService = thresholdService;
    }

    @GetMapping
    public List<RiskAppetiteThreshold> list(@PathVariable String orgId) {
        return thresholdService.list(orgId);
    }

    @PutMapping
    public List<RiskAppetiteThreshold> replace(@PathVariable String orgId,
                                               @RequestBody List<@Valid ThresholdRequest> req) {
        return thresholdService.replaceAll(orgId, req);
    }

    @PostMapping
    public List<RiskAppetiteThreshold> add(@PathVariable String orgId, @Valid @RequestBody ThresholdRequest req) {
        return thresholdService.add(orgId, req);
    }

    @DeleteMapping("/{thresholdId}")
    public List<RiskAppetiteThreshold> delete(@PathVariable String orgId, @PathVariable String thresholdId) {
        return thresholdService.delete(orgId, thresholdId);
    }
}
