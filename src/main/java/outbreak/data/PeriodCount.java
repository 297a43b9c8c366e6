package outbreak.data;

import java.time.LocalDate;
import java.util.Objects;

/** Total cases in the period starting at {@code periodStart}. */
public final class PeriodCount {

    private final LocalDate periodStart;
    private final long count;

    public PeriodCount(LocalDate periodStart, long count) {
        this.periodStart = Objects.requireNonNull(periodStart, "periodStart");
        this.count = count;
    }

    public LocalDate getPeriodStart() { return periodStart; }
    public long getCount() { return count; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeriodCount)) return false;
        PeriodCount that = (PeriodCount) o;
        return count == that.count && periodStart.equals(that.periodStart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(periodStart, count);
    }

    @Override
    public String toString() {
        return periodStart + "=" + count;
    }
}
