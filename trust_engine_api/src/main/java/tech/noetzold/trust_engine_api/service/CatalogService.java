package tech.noetzold.trust_engine_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.*;
import tech.noetzold.trust_engine_api.repository.ClusterMappingRepository;
import tech.noetzold.trust_engine_api.repository.ControlCatalogRepository;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class CatalogService {

    private final ControlCatalogRepository catalogRepo;
    private final ClusterMappingRepository mappingRepo;
    private final ControlNormalizer normalizer;
    private final Clock clock;
    private final double defaultThreshold;

    private final Object importLock = new Object();
    private volatile List<Set<ControlRef>> activeOverrides = List.of();

    public CatalogService(ControlCatalogRepository catalogRepo,
                          ClusterMappingRepository mappingRepo,
                          ControlNormalizer normalizer,
                          Clock clock,
                          @Value("${trust-engine.normalizer.similarity-threshold:0.8}") double defaultThreshold) {
        this.catalogRepo = catalogRepo;
        this.mappingRepo = mappingRepo;
        this.normalizer = normalizer;
        this.clock = clock;
        this.defaultThreshold = defaultThreshold;
    }

    public NormalizationSummary importCatalog(CatalogImportRequest req) {
        double threshold = req.similarity_threshold() != null ? req.similarity_threshold() : defaultThreshold;
        List<Set<ControlRef>> overrides = parseOverrides(req.overrides());
        log.info("Catalog import: {} controls, threshold {}, {} overrides",
                req.controls() != null ? req.controls().size() : 0, threshold, overrides.size());

        synchronized (importLock) {
            // normalize first so a rejected import leaves the active catalog untouched
            List<CanonicalCluster> clusters = normalizer.normalize(req.controls(), threshold, overrides);
            long catalogVersion = catalogRepo.replaceAll(req.controls());
            activeOverrides = overrides;
            return publish(clusters, catalogVersion, threshold, req.controls(), overrides.size());
        }
    }

    /** Re-runs normalization of the stored catalog, e.g. after tuning the threshold. */
    public NormalizationSummary renormalize(Double similarityThreshold) {
        synchronized (importLock) {
            double threshold = similarityThreshold != null ? similarityThreshold : mappingRepo.current().getSimilarityThreshold();
            List<Control> controls = catalogRepo.findAll();
            List<CanonicalCluster> clusters = normalizer.normalize(controls, threshold, activeOverrides);
            return publish(clusters, catalogRepo.currentVersion(), threshold, controls, activeOverrides.size());
        }
    }

    public ClusterMapping currentMapping() {
        return mappingRepo.current();
    }

    public CanonicalCluster cluster(String clusterId) {
        return mappingRepo.current().cluster(clusterId)
                .orElseThrow(() -> new UnknownReferenceException("cluster", clusterId));
    }

    private NormalizationSummary publish(List<CanonicalCluster> clusters,
                                         long catalogVersion,
                                         double threshold,
                                         List<Control> controls,
                                         int overridesApplied) {
        long version = mappingRepo.current().getVersion() + 1;
        ClusterMapping mapping = new ClusterMapping(version, catalogVersion, threshold, clusters, clock.instant());
        mappingRepo.publish(mapping);

        int singletons = (int) clusters.stream().filter(c -> c.memberControls().size() == 1).count();
        int merged = controls.size() - clusters.size();
        double dedupRatio = controls.isEmpty() ? 0.0 : (double) merged / controls.size();

        log.info("Cluster mapping v{} published: {} controls -> {} clusters ({} singletons, {} merged)",
                version, controls.size(), clusters.size(), singletons, merged);

        return new NormalizationSummary(version, catalogVersion, controls.size(),
                List.copyOf(mapping.frameworks()), clusters.size(), merged, singletons,
                overridesApplied, dedupRatio);
    }

    private List<Set<ControlRef>> parseOverrides(List<ControlOverride> overrides) {
        List<Set<ControlRef>> out = new ArrayList<>();
        if (overrides == null) return out;
        for (ControlOverride o : overrides) {
            out.add(new LinkedHashSet<>(List.of(parseRef(o.control_a()), parseRef(o.control_b()))));
        }
        return out;
    }

    private ControlRef parseRef(String raw) {
        try {
            return ControlRef.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new UnknownReferenceException("control", raw);
        }
    }
}
