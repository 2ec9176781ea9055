package tech.noetzold.trust_engine_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.trust_engine_api.exception.StatusConflictException;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.*;
import tech.noetzold.trust_engine_api.repository.ClusterMappingRepository;
import tech.noetzold.trust_engine_api.repository.EvidenceLedgerRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
public class EvidenceService {

    private static final Map<EvidenceStatus, Set<EvidenceStatus>> ALLOWED = Map.of(
            EvidenceStatus.PENDING, EnumSet.of(EvidenceStatus.VERIFIED, EvidenceStatus.REJECTED),
            EvidenceStatus.AUTO_APPROVED, EnumSet.of(EvidenceStatus.VERIFIED, EvidenceStatus.REJECTED),
            EvidenceStatus.VERIFIED, EnumSet.of(EvidenceStatus.REJECTED),
            EvidenceStatus.REJECTED, EnumSet.noneOf(EvidenceStatus.class)
    );

    private final EvidenceLedgerRepository ledger;
    private final ClusterMappingRepository mappingRepo;
    private final Clock clock;
    private final Set<String> autoApproveSources;
    private final double autoApproveConfidence;

    public EvidenceService(EvidenceLedgerRepository ledger,
                           ClusterMappingRepository mappingRepo,
                           Clock clock,
                           @Value("${trust-engine.evidence.auto-approve-sources:}") List<String> autoApproveSources,
                           @Value("${trust-engine.evidence.auto-approve-confidence:0.9}") double autoApproveConfidence) {
        this.ledger = ledger;
        this.mappingRepo = mappingRepo;
        this.clock = clock;
        this.autoApproveSources = autoApproveSources == null ? Set.of() : autoApproveSources.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.autoApproveConfidence = autoApproveConfidence;
    }

    public EvidenceItem ingest(String orgId, EvidenceIngestRequest req) {
        ClusterMapping mapping = mappingRepo.current();

        String clusterId;
        ControlRef anchor;
        if (req.cluster_id() != null && !req.cluster_id().isBlank()) {
            CanonicalCluster cluster = mapping.cluster(req.cluster_id())
                    .orElseThrow(() -> new UnknownReferenceException("cluster", req.cluster_id()));
            clusterId = cluster.clusterId();
            anchor = cluster.memberControls().first();
        } else if (req.raw_control_ref() != null && !req.raw_control_ref().isBlank()) {
            anchor = parseRef(req.raw_control_ref());
            clusterId = mapping.clusterOf(anchor)
                    .orElseThrow(() -> new UnknownReferenceException("control", req.raw_control_ref()));
        } else {
            throw new IllegalArgumentException("Either cluster_id or raw_control_ref is required");
        }

        double confidence = req.confidence() != null ? req.confidence() : Double.NaN;
        if (!(confidence >= 0.0 && confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0, 1]");
        }
        double weight = req.contribution_weight() != null ? req.contribution_weight() : 1.0;
        if (!(weight > 0.0 && weight <= 1.0)) {
            throw new IllegalArgumentException("contribution_weight must be within (0, 1]");
        }

        Instant now = clock.instant();
        String source = req.source_system() != null ? req.source_system().trim() : "manual";
        EvidenceStatus status = autoApproves(source, confidence) ? EvidenceStatus.AUTO_APPROVED : EvidenceStatus.PENDING;

        EvidenceItem item = EvidenceItem.builder()
                .evidenceId(generateEvidenceId())
                .orgId(orgId)
                .clusterId(clusterId)
                .anchorControl(anchor)
                .confidence(confidence)
                .status(status)
                .collectedAt(req.collected_at() != null ? req.collected_at() : now)
                .ingestedAt(now)
                .contributionWeight(weight)
                .sourceSystem(source)
                .revision(1)
                .build();

        ledger.append(item);
        log.info("Evidence {} ingested for org {} on cluster {} from {} as {}",
                item.evidenceId(), orgId, clusterId, source, status);
        return item;
    }

    /**
     * Moves an item from {@code expected} to {@code next}. Fails if the stored status is not
     * {@code expected} anymore, which is how concurrent reviewers are kept from overwriting each other.
     */
    public EvidenceItem transition(String orgId, String evidenceId, EvidenceStatus expected, EvidenceStatus next) {
        EvidenceItem current = ledger.findLatest(orgId, evidenceId)
                .orElseThrow(() -> new UnknownReferenceException("evidence", evidenceId));

        if (current.status() != expected) {
            throw new StatusConflictException("Evidence " + evidenceId + " is " + current.status() + ", expected " + expected);
        }
        if (!ALLOWED.get(expected).contains(next)) {
            throw new StatusConflictException("Evidence cannot move from " + expected + " to " + next);
        }

        EvidenceItem updated = current.withStatus(next);
        if (!ledger.compareAndSet(orgId, evidenceId, current, updated)) {
            throw new StatusConflictException("Evidence " + evidenceId + " was modified concurrently");
        }
        log.info("Evidence {} for org {}: {} -> {}", evidenceId, orgId, expected, next);
        return updated;
    }

    public List<EvidenceItem> history(String orgId, String evidenceId) {
        List<EvidenceItem> revisions = ledger.history(orgId, evidenceId);
        if (revisions.isEmpty()) {
            throw new UnknownReferenceException("evidence", evidenceId);
        }
        return revisions;
    }

    public List<EvidenceItem> currentEvidence(String orgId) {
        return ledger.findLatestByOrg(orgId);
    }

    private boolean autoApproves(String source, double confidence) {
        return confidence >= autoApproveConfidence && autoApproveSources.contains(source.toLowerCase(Locale.ROOT));
    }

    private ControlRef parseRef(String raw) {
        try {
            return ControlRef.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new UnknownReferenceException("control", raw);
        }
    }

    private String generateEvidenceId() {
        return "ev_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
