package outbreak.data;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Buckets case records into a regular, gap-free count series per (entity, disease).
 * <p>
 * Each series spans from the period of its earliest record to the period of its latest;
 * periods without records are filled with zero. Counts are summed, so the output does not
 * depend on the order of the input.
 */
public class Aggregator {

    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    private final PeriodGranularity granularity;

    public Aggregator(PeriodGranularity granularity) {
        this.granularity = Objects.requireNonNull(granularity, "granularity");
    }

    public BucketedSeries aggregate(Collection<CaseRecord> records) {
        Map<SeriesKey, TreeMap<LocalDate, Long>> sums = new HashMap<>();
        for (CaseRecord r : records) {
            LocalDate period = granularity.align(r.getDate());
            sums.computeIfAbsent(r.key(), k -> new TreeMap<>()).merge(period, r.getCount(), Long::sum);
        }

        Map<SeriesKey, SeriesSlice> slices = new TreeMap<>();
        for (Map.Entry<SeriesKey, TreeMap<LocalDate, Long>> e : sums.entrySet()) {
            TreeMap<LocalDate, Long> byPeriod = e.getValue();
            List<PeriodCount> periods = new ArrayList<>();
            LocalDate last = byPeriod.lastKey();
            for (LocalDate p = byPeriod.firstKey(); !p.isAfter(last); p = granularity.next(p)) {
                periods.add(new PeriodCount(p, byPeriod.getOrDefault(p, 0L)));
            }
            slices.put(e.getKey(), new SeriesSlice(e.getKey(), granularity, periods));
        }
        log.debug("Aggregated {} records into {} {} series", records.size(), slices.size(), granularity);
        return new BucketedSeries(granularity, slices);
    }

    public PeriodGranularity getGranularity() {
        return granularity;
    }
}
