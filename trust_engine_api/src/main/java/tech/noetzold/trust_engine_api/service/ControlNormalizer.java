package tech.noetzold.trust_engine_api.service;

import lombok.extern.slf4j.Slf4j;
import tech.noetzold.trust_engine_api.exception.ConfigurationException;
import tech.noetzold.trust_engine_api.exception.UnknownReferenceException;
import tech.noetzold.trust_engine_api.model.CanonicalCluster;
import tech.noetzold.trust_engine_api.model.Control;
import tech.noetzold.trust_engine_api.model.ControlRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Greedy clustering of per-framework controls into canonical requirement groups.
 *
 * <p>Controls are visited in catalog order and compared with each existing cluster's
 * representative (its first member). A control joins the most similar cluster at or
 * above the threshold, lowest cluster id on ties, otherwise it opens a new cluster.
 * Admin overrides are applied before any similarity is computed. The output depends
 * only on the catalog order, the threshold and the overrides.
 */
@Slf4j
public class ControlNormalizer {

    private final DescriptionCanonicalizer canonicalizer;

    public ControlNormalizer(DescriptionCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    public List<CanonicalCluster> normalize(List<Control> catalog,
                                            double similarityThreshold,
                                            List<Set<ControlRef>> overrides) {
        if (catalog == null || catalog.isEmpty()) {
            throw new ConfigurationException("Control catalog is empty");
        }
        if (!(similarityThreshold > 0.0 && similarityThreshold <= 1.0)) {
            throw new ConfigurationException("Similarity threshold must be within (0, 1], got " + similarityThreshold);
        }

        Set<ControlRef> known = new HashSet<>();
        for (Control c : catalog) {
            if (!known.add(c.ref())) {
                throw new ConfigurationException("Duplicate control in catalog: " + c.ref());
            }
        }
        Map<ControlRef, ControlRef> groupOf = overrideGroups(overrides, known);

        List<Draft> drafts = new ArrayList<>();
        Map<ControlRef, Integer> clusterOfGroup = new HashMap<>();

        for (Control control : catalog) {
            SortedSet<String> terms = canonicalizer.canonicalize(control.description());
            ControlRef group = groupOf.get(control.ref());
            Integer target = group != null ? clusterOfGroup.get(group) : null;

            if (target == null) {
                double best = -1.0;
                for (int i = 0; i < drafts.size(); i++) {
                    double sim = canonicalizer.similarity(terms, drafts.get(i).representativeTerms);
                    // strict '>' keeps the lowest cluster id on equal scores
                    if (sim >= similarityThreshold && sim > best) {
                        best = sim;
                        target = i;
                    }
                }
            }
            if (target == null) {
                drafts.add(new Draft(control, terms));
                target = drafts.size() - 1;
            } else {
                drafts.get(target).members.add(control.ref());
            }
            if (group != null) {
                clusterOfGroup.putIfAbsent(group, target);
            }
        }

        List<CanonicalCluster> clusters = new ArrayList<>(drafts.size());
        for (int i = 0; i < drafts.size(); i++) {
            Draft d = drafts.get(i);
            clusters.add(new CanonicalCluster(clusterId(i), d.members,
                    d.representative.description(), d.representative.category()));
        }
        log.debug("Normalized {} controls into {} clusters at threshold {}",
                catalog.size(), clusters.size(), similarityThreshold);
        return clusters;
    }

    static String clusterId(int index) {
        return String.format("CC-%04d", index + 1);
    }

    /** Union-find over the override pairs; maps each overridden control to its group root. */
    private Map<ControlRef, ControlRef> overrideGroups(List<Set<ControlRef>> overrides, Set<ControlRef> known) {
        Map<ControlRef, ControlRef> parent = new HashMap<>();
        if (overrides == null) return parent;

        for (Set<ControlRef> pair : overrides) {
            ControlRef first = null;
            for (ControlRef ref : pair) {
                if (!known.contains(ref)) {
                    throw new UnknownReferenceException("control", ref.toString());
                }
                parent.putIfAbsent(ref, ref);
                if (first == null) {
                    first = ref;
                } else {
                    union(parent, first, ref);
                }
            }
        }
        Map<ControlRef, ControlRef> roots = new HashMap<>();
        for (ControlRef ref : parent.keySet()) {
            roots.put(ref, find(parent, ref));
        }
        return roots;
    }

    private static ControlRef find(Map<ControlRef, ControlRef> parent, ControlRef ref) {
        ControlRef root = ref;
        while (!parent.get(root).equals(root)) {
            root = parent.get(root);
        }
        return root;
    }

    private static void union(Map<ControlRef, ControlRef> parent, ControlRef a, ControlRef b) {
        ControlRef ra = find(parent, a);
        ControlRef rb = find(parent, b);
        if (ra.equals(rb)) return;
        // smaller ref becomes the root so grouping does not depend on pair order
        if (ra.compareTo(rb) < 0) {
            parent.put(rb, ra);
        } else {
            parent.put(ra, rb);
        }
    }

    private static final class Draft {
        final Control representative;
        final SortedSet<String> representativeTerms;
        final SortedSet<ControlRef> members = new TreeSet<>();

        Draft(Control representative, SortedSet<String> terms) {
            this.representative = representative;
            this.representativeTerms = terms;
            this.members.add(representative.ref());
        }
    }
}
