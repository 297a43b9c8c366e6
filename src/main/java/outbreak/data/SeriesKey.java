package outbreak.data;

import java.util.Comparator;
import java.util.Objects;

/** Identifies one (entity, disease) series. Ordered by entity, then disease. */
public final class SeriesKey implements Comparable<SeriesKey> {

    private static final Comparator<SeriesKey> ORDER =
        Comparator.comparing(SeriesKey::getEntity).thenComparing(SeriesKey::getDisease);

    private final String entity;
    private final String disease;

    public SeriesKey(String entity, String disease) {
        if (entity == null || entity.isBlank()) throw new IllegalArgumentException("entity required");
        if (disease == null || disease.isBlank()) throw new IllegalArgumentException("disease required");
        this.entity = entity;
        this.disease = disease;
    }

    public String getEntity() { return entity; }
    public String getDisease() { return disease; }

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeriesKey)) return false;
        SeriesKey that = (SeriesKey) o;
        return entity.equals(that.entity) && disease.equals(that.disease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, disease);
    }

    @Override
    public String toString() {
        return entity + "/" + disease;
    }
}
