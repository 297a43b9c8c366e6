package outbreak.data;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Width of one bucket in a {@link BucketedSeries}.
 * <p>
 * Every period is identified by its start day; all series bucketed with the same
 * granularity share one grid (weeks start on Monday, months on the 1st).
 */
public enum PeriodGranularity {

    DAILY {
        @Override
        public LocalDate align(LocalDate date) {
            return date;
        }

        @Override
        public LocalDate next(LocalDate periodStart) {
            return periodStart.plusDays(1);
        }
    },

    /** Monday-start weeks, i.e. weeks ending on Sunday. */
    WEEKLY {
        @Override
        public LocalDate align(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public LocalDate next(LocalDate periodStart) {
            return periodStart.plusWeeks(1);
        }
    },

    MONTHLY {
        @Override
        public LocalDate align(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public LocalDate next(LocalDate periodStart) {
            return periodStart.plusMonths(1);
        }
    };

    /** Start of the period that contains {@code date}. */
    public abstract LocalDate align(LocalDate date);

    /** Start of the period after the one starting at {@code periodStart}. */
    public abstract LocalDate next(LocalDate periodStart);
}
