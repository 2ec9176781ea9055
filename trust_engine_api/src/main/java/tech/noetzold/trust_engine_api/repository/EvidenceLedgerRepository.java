package tech.noetzold.trust_engine_api.repository;

import tech.noetzold.trust_engine_api.model.EvidenceItem;

import java.util.List;
import java.util.Optional;

public interface EvidenceLedgerRepository {
    EvidenceItem append(EvidenceItem item);

    Optional<EvidenceItem> findLatest(String orgId, String evidenceId);

    List<EvidenceItem> findLatestByOrg(String orgId);

    List<EvidenceItem> history(String orgId, String evidenceId);

    boolean compareAndSet(String orgId, String evidenceId, EvidenceItem expected, EvidenceItem next);
}
