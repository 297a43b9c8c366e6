package outbreak.data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Gap-free bucketed history of one (entity, disease) pair.
 * <p>
 * Periods are grid-aligned and consecutive: each period start is
 * {@code granularity.next(previous)}.
 */
public final class SeriesSlice {

    private final SeriesKey key;
    private final PeriodGranularity granularity;
    private final List<PeriodCount> periods;

    public SeriesSlice(SeriesKey key, PeriodGranularity granularity, List<PeriodCount> periods) {
        this.key = Objects.requireNonNull(key, "key");
        this.granularity = Objects.requireNonNull(granularity, "granularity");
        Objects.requireNonNull(periods, "periods");
        for (int i = 0; i < periods.size(); i++) {
            LocalDate start = periods.get(i).getPeriodStart();
            if (!granularity.align(start).equals(start)) {
                throw new IllegalArgumentException(key + ": period " + start + " is not aligned to " + granularity);
            }
            if (i > 0 && !granularity.next(periods.get(i - 1).getPeriodStart()).equals(start)) {
                throw new IllegalArgumentException(key + ": gap or disorder before period " + start);
            }
        }
        this.periods = Collections.unmodifiableList(new ArrayList<>(periods));
    }

    /** Builds a slice of consecutive periods starting at {@code firstPeriod}. */
    public static SeriesSlice of(SeriesKey key, PeriodGranularity granularity, LocalDate firstPeriod, long... counts) {
        List<PeriodCount> out = new ArrayList<>(counts.length);
        LocalDate period = granularity.align(firstPeriod);
        for (long c : counts) {
            out.add(new PeriodCount(period, c));
            period = granularity.next(period);
        }
        return new SeriesSlice(key, granularity, out);
    }

    public SeriesKey getKey() { return key; }
    public PeriodGranularity getGranularity() { return granularity; }
    public List<PeriodCount> getPeriods() { return periods; }

    public int size() {
        return periods.size();
    }

    public boolean isEmpty() {
        return periods.isEmpty();
    }

    /** Counts as doubles, oldest first. */
    public double[] values() {
        double[] out = new double[periods.size()];
        for (int i = 0; i < out.length; i++) out[i] = periods.get(i).getCount();
        return out;
    }

    public long totalCount() {
        long sum = 0;
        for (PeriodCount p : periods) sum += p.getCount();
        return sum;
    }

    public LocalDate lastPeriodStart() {
        if (periods.isEmpty()) throw new IllegalStateException(key + ": empty series");
        return periods.get(periods.size() - 1).getPeriodStart();
    }

    /** The {@code steps} period starts following the last observed period. */
    public List<LocalDate> futurePeriods(int steps) {
        List<LocalDate> out = new ArrayList<>(steps);
        LocalDate period = lastPeriodStart();
        for (int i = 0; i < steps; i++) {
            period = granularity.next(period);
            out.add(period);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SeriesSlice)) return false;
        SeriesSlice that = (SeriesSlice) o;
        return key.equals(that.key) && granularity == that.granularity && periods.equals(that.periods);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, granularity, periods);
    }

    @Override
    public String toString() {
        return "SeriesSlice{" + key + ", " + granularity + ", " + periods.size() + " periods}";
    }
}
