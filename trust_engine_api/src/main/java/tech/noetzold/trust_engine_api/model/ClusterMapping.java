package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable, versioned snapshot of the catalog's cluster assignment. A new
 * normalization run produces a new instance; readers keep whichever one they took.
 */
public final class ClusterMapping {

    private final long version;
    private final long catalogVersion;
    private final double similarityThreshold;
    private final List<CanonicalCluster> clusters;
    private final Map<String, CanonicalCluster> byId;
    private final Map<ControlRef, String> clusterOfControl;
    private final Instant createdAt;

    public ClusterMapping(long version,
                          long catalogVersion,
                          double similarityThreshold,
                          List<CanonicalCluster> clusters,
                          Instant createdAt) {
        this.version = version;
        this.catalogVersion = catalogVersion;
        this.similarityThreshold = similarityThreshold;
        this.clusters = List.copyOf(clusters);
        this.createdAt = createdAt;

        Map<String, CanonicalCluster> ids = new LinkedHashMap<>();
        Map<ControlRef, String> index = new HashMap<>();
        for (CanonicalCluster c : this.clusters) {
            ids.put(c.clusterId(), c);
            for (ControlRef ref : c.memberControls()) {
                String previous = index.put(ref, c.clusterId());
                if (previous != null) {
                    throw new IllegalStateException("control " + ref + " assigned to both " + previous + " and " + c.clusterId());
                }
            }
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.clusterOfControl = Collections.unmodifiableMap(index);
    }

    public static ClusterMapping empty() {
        return new ClusterMapping(0, 0, 0.0, List.of(), Instant.EPOCH);
    }

    public long getVersion() {
        return version;
    }

    @JsonProperty("catalog_version")
    public long getCatalogVersion() {
        return catalogVersion;
    }

    @JsonProperty("similarity_threshold")
    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public List<CanonicalCluster> getClusters() {
        return clusters;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return clusters.isEmpty();
    }

    public Optional<CanonicalCluster> cluster(String clusterId) {
        return Optional.ofNullable(clusterId).map(byId::get);
    }

    public Optional<String> clusterOf(ControlRef ref) {
        return Optional.ofNullable(ref).map(clusterOfControl::get);
    }

    @JsonIgnore
    public SortedSet<String> frameworks() {
        SortedSet<String> out = new TreeSet<>();
        clusterOfControl.keySet().forEach(r -> out.add(r.frameworkId()));
        return out;
    }

    @JsonIgnore
    public int controlCount() {
        return clusterOfControl.size();
    }
}
