package tech.noetzold.trust_engine_api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

public record CanonicalCluster(
        @JsonProperty("cluster_id") String clusterId,
        @JsonProperty("member_controls") SortedSet<ControlRef> memberControls,
        @JsonProperty("representative_description") String representativeDescription,
        String category
) {
    public CanonicalCluster {
        memberControls = Collections.unmodifiableSortedSet(new TreeSet<>(memberControls));
    }

    public long controlCountIn(String frameworkId) {
        return memberControls.stream().filter(r -> r.frameworkId().equals(frameworkId)).count();
    }

    public Set<String> frameworks() {
        Set<String> out = new TreeSet<>();
        memberControls.forEach(r -> out.add(r.frameworkId()));
        return out;
    }
}
