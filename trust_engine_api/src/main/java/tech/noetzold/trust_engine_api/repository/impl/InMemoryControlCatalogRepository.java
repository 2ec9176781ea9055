package tech.noetzold.trust_engine_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.trust_engine_api.model.Control;
import tech.noetzold.trust_engine_api.model.ControlRef;
import tech.noetzold.trust_engine_api.repository.ControlCatalogRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class InMemoryControlCatalogRepository implements ControlCatalogRepository {

    // catalog order matters to the normalizer, so snapshots keep insertion order
    private volatile Snapshot snapshot = new Snapshot(0, List.of(), Map.of());

    @Override
    public synchronized long replaceAll(List<Control> controls) {
        Map<ControlRef, Control> index = new LinkedHashMap<>();
        for (Control c : controls) {
            index.put(c.ref(), c);
        }
        long next = snapshot.version() + 1;
        snapshot = new Snapshot(next, List.copyOf(controls), Map.copyOf(index));
        return next;
    }

    @Override
    public List<Control> findAll() {
        return snapshot.controls();
    }

    @Override
    public Optional<Control> findByRef(ControlRef ref) {
        if (ref == null) return Optional.empty();
        return Optional.ofNullable(snapshot.index().get(ref));
    }

    @Override
    public long currentVersion() {
        return snapshot.version();
    }

    private record Snapshot(long version, List<Control> controls, Map<ControlRef, Control> index) {}
}
