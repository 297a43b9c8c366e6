package outbreak.cluster;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Per-entity disease burden: one vector per entity, positions following {@link #getDiseases()}.
 * Every entity has a value for every disease.
 */
public final class EntityProfile {

    private final List<String> diseases;
    private final SortedMap<String, double[]> vectors;

    public EntityProfile(List<String> diseases, Map<String, double[]> vectors) {
        this.diseases = List.copyOf(diseases);
        TreeMap<String, double[]> copy = new TreeMap<>();
        for (Map.Entry<String, double[]> e : vectors.entrySet()) {
            if (e.getValue().length != this.diseases.size()) {
                throw new IllegalArgumentException("profile of " + e.getKey() + " has " + e.getValue().length
                    + " values for " + this.diseases.size() + " diseases");
            }
            copy.put(e.getKey(), e.getValue().clone());
        }
        this.vectors = Collections.unmodifiableSortedMap(copy);
    }

    public List<String> getDiseases() { return diseases; }

    /** Entities in sorted order. */
    public List<String> entities() {
        return List.copyOf(vectors.keySet());
    }

    public int size() {
        return vectors.size();
    }

    public int dimensions() {
        return diseases.size();
    }

    /** A copy of the entity's vector, or null for an unknown entity. */
    public double[] vector(String entity) {
        double[] v = vectors.get(entity);
        return v == null ? null : v.clone();
    }

    public double value(String entity, String disease) {
        int col = diseases.indexOf(disease);
        if (col < 0) throw new IllegalArgumentException("untracked disease " + disease);
        double[] v = vectors.get(entity);
        if (v == null) throw new IllegalArgumentException("unknown entity " + entity);
        return v[col];
    }
}
