package tech.noetzold.trust_engine_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.trust_engine_api.model.CoverageReport;
import tech.noetzold.trust_engine_api.model.FrameworkWeightsRequest;
import tech.noetzold.trust_engine_api.service.TrustScoreService;

import java.util.Map;

@RestController
@RequestMapping("/organizations/{orgId}")
@Tag(name = "Trust score")
public class TrustScoreController {

    private final TrustScoreService trustScoreService;

    public TrustScoreController(TrustScoreService trustScoreService) {
        this.trustScoreService = trustScoreService;
    }

    @GetMapping("/trust-score")
    public CoverageReport trustScore(@PathVariable String orgId,
                                     @RequestParam(name = "mapping_version", required = false) Long mappingVersion) {
        return mappingVersion == null
                ? trustScoreService.getTrustScore(orgId)
                : trustScoreService.getTrustScore(orgId, mappingVersion);
    }

    @GetMapping("/framework-weights")
    public Map<String, Double> frameworkWeights(@PathVariable String orgId) {
        return trustScoreService.frameworkWeights(orgId);
    }

    @PutMapping("/framework-weights")
    public Map<String, Double> updateFrameworkWeights(@PathVariable String orgId,
                                                      @Valid @RequestBody FrameworkWeightsRequest req) {
        return trustScoreService.updateFrameworkWeights(orgId, req.weights());
    }
}
