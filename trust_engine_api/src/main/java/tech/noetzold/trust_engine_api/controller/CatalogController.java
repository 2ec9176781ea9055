package tech.noetzold.trust_engine_api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.trust_engine_api.model.CanonicalCluster;
import tech.noetzold.trust_engine_api.model.CatalogImportRequest;
import tech.noetzold.trust_engine_api.model.ClusterMapping;
import tech.noetzold.trust_engine_api.model.NormalizationSummary;
import tech.noetzold.trust_engine_api.service.CatalogService;

@RestController
@RequestMapping("/catalog")
@Tag(name = "Catalog")
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @PostMapping("/import")
    @Operation(summary = "Replace the control catalog and publish a new cluster mapping")
    public NormalizationSummary importCatalog(@Valid @RequestBody CatalogImportRequest req) {
        return catalogService.importCatalog(req);
    }

    @PostMapping("/renormalize")
    @Operation(summary = "Re-cluster the stored catalog, optionally with a new similarity threshold")
    public NormalizationSummary renormalize(@RequestParam(name = "similarity_threshold", required = false) Double threshold) {
        return catalogService.renormalize(threshold);
    }

    @GetMapping("/clusters")
    public ClusterMapping clusters() {
        return catalogService.currentMapping();
    }

    @GetMapping("/clusters/{clusterId}")
    public CanonicalCluster cluster(@PathVariable String clusterId) {
        return catalogService.cluster(clusterId);
    }
}
