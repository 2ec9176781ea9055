package tech.noetzold.trust_engine_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.trust_engine_api.model.EvidenceIngestRequest;
import tech.noetzold.trust_engine_api.model.EvidenceItem;
import tech.noetzold.trust_engine_api.model.StatusTransitionRequest;
import tech.noetzold.trust_engine_api.service.EvidenceService;

import java.util.List;

@RestController
@RequestMapping("/organizations/{orgId}/evidence")
@Tag(name = "Evidence")
public class EvidenceController {

    private final EvidenceService evidenceService;

    public EvidenceController(EvidenceService evidenceService) {
        this.evidenceService = evidenceService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public EvidenceItem ingest(@PathVariable String orgId, @Valid @RequestBody EvidenceIngestRequest req) {
        return evidenceService.ingest(orgId, req);
    }

    @GetMapping
    public List<EvidenceItem> current(@PathVariable String orgId) {
        return evidenceService.currentEvidence(orgId);
    }

    @PostMapping("/{evidenceId}/transition")
    public EvidenceItem transition(@PathVariable String orgId,
                                   @PathVariable String evidenceId,
                                   @Valid @RequestBody StatusTransitionRequest req) {
        return evidenceService.transition(orgId, evidenceId, req.expected(), req.next());
    }

    @GetMapping("/{evidenceId}/history")
    public List<EvidenceItem> history(@PathVariable String orgId, @PathVariable String evidenceId) {
        return evidenceService.history(orgId, evidenceId);
    }
}
