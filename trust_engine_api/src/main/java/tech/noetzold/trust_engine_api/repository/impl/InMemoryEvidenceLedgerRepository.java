package tech.noetzold.trust_engine_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.trust_engine_api.model.EvidenceItem;
import tech.noetzold.trust_engine_api.repository.EvidenceLedgerRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Append-only ledger partitioned by organization. The latest revision of each item
 * sits behind an {@link AtomicReference} so status changes are compare-and-swap.
 */
@Repository
public class InMemoryEvidenceLedgerRepository implements EvidenceLedgerRepository {

    private final Map<String, Map<String, Entry>> byOrg = new ConcurrentHashMap<>();

    @Override
    public EvidenceItem append(EvidenceItem item) {
        Entry entry = new Entry(item);
        Entry existing = partition(item.orgId()).putIfAbsent(item.evidenceId(), entry);
        if (existing != null) {
            throw new IllegalStateException("evidence " + item.evidenceId() + " already exists");
        }
        return item;
    }

    @Override
    public Optional<EvidenceItem> findLatest(String orgId, String evidenceId) {
        return Optional.ofNullable(partition(orgId).get(evidenceId)).map(e -> e.latest.get());
    }

    @Override
    public List<EvidenceItem> findLatestByOrg(String orgId) {
        return partition(orgId).values().stream()
                .map(e -> e.latest.get())
                .sorted(Comparator.comparing(EvidenceItem::evidenceId))
                .toList();
    }

    @Override
    public List<EvidenceItem> history(String orgId, String evidenceId) {
        Entry entry = partition(orgId).get(evidenceId);
        return entry == null ? List.of() : List.copyOf(entry.revisions);
    }

    @Override
    public boolean compareAndSet(String orgId, String evidenceId, EvidenceItem expected, EvidenceItem next) {
        Entry entry = partition(orgId).get(evidenceId);
        if (entry == null) return false;
        synchronized (entry) {
            if (!entry.latest.compareAndSet(expected, next)) {
                return false;
            }
            entry.revisions.add(next);
            return true;
        }
    }

    private Map<String, Entry> partition(String orgId) {
        return byOrg.computeIfAbsent(orgId, k -> new ConcurrentHashMap<>());
    }

    private static final class Entry {
        final AtomicReference<EvidenceItem> latest;
        final List<EvidenceItem> revisions = new CopyOnWriteArrayList<>();

        Entry(EvidenceItem first) {
            this.latest = new AtomicReference<>(first);
            this.revisions.add(first);
        }
    }
}
