package tech.noetzold.trust_engine_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.trust_engine_api.exception.ConfigurationException;
import tech.noetzold.trust_engine_api.exception.StaleSnapshotException;
import tech.noetzold.trust_engine_api.model.ClusterMapping;
import tech.noetzold.trust_engine_api.model.CoverageReport;
import tech.noetzold.trust_engine_api.repository.ClusterMappingRepository;
import tech.noetzold.trust_engine_api.repository.EvidenceLedgerRepository;
import tech.noetzold.trust_engine_api.repository.OrganizationSettingsRepository;

import java.time.Clock;
import java.util.Map;

@Slf4j
@Service
public class TrustScoreService {

    private static final int MAX_STALE_RETRIES = 3;

    private final ClusterMappingRepository mappingRepo;
    private final EvidenceLedgerRepository ledger;
    private final OrganizationSettingsRepository settingsRepo;
    private final CoverageCalculator calculator;
    private final Clock clock;

    public TrustScoreService(ClusterMappingRepository mappingRepo,
                             EvidenceLedgerRepository ledger,
                             OrganizationSettingsRepository settingsRepo,
                             CoverageCalculator calculator,
                             Clock clock) {
        this.mappingRepo = mappingRepo;
        this.ledger = ledger;
        this.settingsRepo = settingsRepo;
        this.calculator = calculator;
        this.clock = clock;
    }

    /** Scores against the active mapping, retrying if a new mapping is published mid-computation. */
    public CoverageReport getTrustScore(String orgId) {
        StaleSnapshotException last = null;
        for (int attempt = 1; attempt <= MAX_STALE_RETRIES; attempt++) {
            ClusterMapping snapshot = mappingRepo.current();
            try {
                return computePinned(orgId, snapshot);
            } catch (StaleSnapshotException e) {
                last = e;
                log.debug("Trust score for org {} hit stale mapping v{} (attempt {}), retrying",
                        orgId, e.getRequestedVersion(), attempt);
            }
        }
        throw last;
    }

    /** Scores against a specific mapping version; fails if it is no longer the active one. */
    public CoverageReport getTrustScore(String orgId, long mappingVersion) {
        ClusterMapping snapshot = mappingRepo.current();
        if (snapshot.getVersion() != mappingVersion) {
            throw new StaleSnapshotException(mappingVersion, snapshot.getVersion());
        }
        return computePinned(orgId, snapshot);
    }

    public Map<String, Double> frameworkWeights(String orgId) {
        return settingsRepo.findFrameworkWeights(orgId);
    }

    public Map<String, Double> updateFrameworkWeights(String orgId, Map<String, Double> weights) {
        double sum = 0.0;
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            Double w = e.getValue();
            if (w == null || w.isNaN() || w.isInfinite() || w < 0.0) {
                throw new ConfigurationException("Framework weight for " + e.getKey() + " must be a non-negative number");
            }
            sum += w;
        }
        if (!weights.isEmpty() && sum == 0.0) {
            throw new ConfigurationException("At least one framework weight must be positive");
        }
        settingsRepo.saveFrameworkWeights(orgId, weights);
        log.info("Framework weights updated for org {}: {}", orgId, weights);
        return settingsRepo.findFrameworkWeights(orgId);
    }

    private CoverageReport computePinned(String orgId, ClusterMapping snapshot) {
        CoverageReport report = calculator.compute(orgId, snapshot, ledger.findLatestByOrg(orgId),
                clock.instant(), settingsRepo.findFrameworkWeights(orgId));
        long active = mappingRepo.current().getVersion();
        if (active != snapshot.getVersion()) {
            throw new StaleSnapshotException(snapshot.getVersion(), active);
        }
        return report;
    }
}
