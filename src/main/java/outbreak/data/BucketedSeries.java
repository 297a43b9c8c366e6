package outbreak.data;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/** Time-bucketed counts for every observed (entity, disease) pair, keyed in sorted order. */
public final class BucketedSeries {

    private final PeriodGranularity granularity;
    private final SortedMap<SeriesKey, SeriesSlice> slices;

    public BucketedSeries(PeriodGranularity granularity, Map<SeriesKey, SeriesSlice> slices) {
        this.granularity = Objects.requireNonNull(granularity, "granularity");
        TreeMap<SeriesKey, SeriesSlice> copy = new TreeMap<>();
        for (Map.Entry<SeriesKey, SeriesSlice> e : slices.entrySet()) {
            SeriesSlice slice = e.getValue();
            if (!e.getKey().equals(slice.getKey())) {
                throw new IllegalArgumentException("slice " + slice.getKey() + " filed under " + e.getKey());
            }
            if (slice.getGranularity() != granularity) {
                throw new IllegalArgumentException(slice.getKey() + " is " + slice.getGranularity() + ", expected " + granularity);
            }
            copy.put(e.getKey(), slice);
        }
        this.slices = Collections.unmodifiableSortedMap(copy);
    }

    public PeriodGranularity getGranularity() { return granularity; }

    public List<SeriesKey> keys() {
        return List.copyOf(slices.keySet());
    }

    public boolean contains(SeriesKey key) {
        return slices.containsKey(key);
    }

    /** The slice for {@code key}, or null when the pair was never observed. */
    public SeriesSlice slice(SeriesKey key) {
        return slices.get(key);
    }

    public List<SeriesSlice> slicesFor(String entity) {
        return slices.values().stream()
            .filter(s -> s.getKey().getEntity().equals(entity))
            .collect(Collectors.toList());
    }

    public SortedSet<String> entities() {
        SortedSet<String> out = new TreeSet<>();
        for (SeriesKey k : slices.keySet()) out.add(k.getEntity());
        return Collections.unmodifiableSortedSet(out);
    }

    public SortedSet<String> diseases() {
        SortedSet<String> out = new TreeSet<>();
        for (SeriesKey k : slices.keySet()) out.add(k.getDisease());
        return Collections.unmodifiableSortedSet(out);
    }

    public boolean isEmpty() {
        return slices.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BucketedSeries)) return false;
        BucketedSeries that = (BucketedSeries) o;
        return granularity == that.granularity && slices.equals(that.slices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(granularity, slices);
    }
}
