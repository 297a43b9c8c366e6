package outbreak.data;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One reported count of a disease in an administrative region on a given day.
 * Produced by ingestion, never modified afterwards.
 */
public final class CaseRecord {

    private final String entity;
    private final LocalDate date;
    private final String disease;
    private final long count;

    public CaseRecord(String entity, LocalDate date, String disease, long count) {
        if (entity == null || entity.isBlank()) throw new IllegalArgumentException("entity required");
        if (date == null) throw new IllegalArgumentException("date required");
        if (disease == null || disease.isBlank()) throw new IllegalArgumentException("disease required");
        if (count < 0) throw new IllegalArgumentException("count must be >= 0, got " + count);
        this.entity = entity;
        this.date = date;
        this.disease = disease;
        this.count = count;
    }

    public String getEntity() { return entity; }
    public LocalDate getDate() { return date; }
    public String getDisease() { return disease; }
    public long getCount() { return count; }

    public SeriesKey key() {
        return new SeriesKey(entity, disease);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaseRecord)) return false;
        CaseRecord that = (CaseRecord) o;
        return count == that.count && entity.equals(that.entity)
            && date.equals(that.date) && disease.equals(that.disease);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, date, disease, count);
    }

    @Override
    public String toString() {
        return "CaseRecord{" + entity + ", " + date + ", " + disease + "=" + count + "}";
    }
}
