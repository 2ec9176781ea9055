package tech.noetzold.trust_engine_api.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.trust_engine_api.model.ClusterMapping;
import tech.noetzold.trust_engine_api.repository.ClusterMappingRepository;

import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicReference;

@Repository
public class InMemoryClusterMappingRepository implements ClusterMappingRepository {

    private final AtomicReference<ClusterMapping> active = new AtomicReference<>(ClusterMapping.empty());
    private final ConcurrentSkipListMap<Long, ClusterMapping> versions = new ConcurrentSkipListMap<>();

    @Override
    public ClusterMapping current() {
        return active.get();
    }

    @Override
    public Optional<ClusterMapping> findByVersion(long version) {
        return Optional.ofNullable(versions.get(version));
    }

    @Override
    public void publish(ClusterMapping mapping) {
        ClusterMapping prev;
        do {
            prev = active.get();
            if (mapping.getVersion() <= prev.getVersion()) {
                throw new IllegalStateException("mapping version " + mapping.getVersion()
                        + " is not newer than active version " + prev.getVersion());
            }
        } while (!active.compareAndSet(prev, mapping));
        versions.put(mapping.getVersion(), mapping);
    }
}
