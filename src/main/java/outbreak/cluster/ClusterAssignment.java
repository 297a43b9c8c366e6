package outbreak.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Cluster id in {@code [0, k)} for every profiled entity. */
public final class ClusterAssignment {

    private final int k;
    private final SortedMap<String, Integer> labels;

    public ClusterAssignment(int k, Map<String, Integer> labels) {
        for (Map.Entry<String, Integer> e : labels.entrySet()) {
            int id = e.getValue();
            if (id < 0 || id >= k) {
                throw new IllegalArgumentException("cluster id " + id + " of " + e.getKey() + " outside [0, " + k + ")");
            }
        }
        this.k = k;
        this.labels = Collections.unmodifiableSortedMap(new TreeMap<>(labels));
    }

    public int k() {
        return k;
    }

    public int clusterOf(String entity) {
        Integer id = labels.get(entity);
        if (id == null) throw new IllegalArgumentException("entity " + entity + " was not clustered");
        return id;
    }

    public List<String> members(int clusterId) {
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, Integer> e : labels.entrySet()) {
            if (e.getValue() == clusterId) out.add(e.getKey());
        }
        return out;
    }

    public SortedMap<String, Integer> asMap() {
        return labels;
    }

    public int size() {
        return labels.size();
    }
}
