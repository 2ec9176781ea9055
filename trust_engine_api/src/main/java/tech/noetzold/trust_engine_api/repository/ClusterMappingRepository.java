package tech.noetzold.trust_engine_api.repository;

import tech.noetzold.trust_engine_api.model.ClusterMapping;

import java.util.Optional;

public interface ClusterMappingRepository {
    ClusterMapping current();

    Optional<ClusterMapping> findByVersion(long version);

    /** Atomically makes {@code mapping} the active one; its version must be newer than the current. */
    void publish(ClusterMapping mapping);
}
