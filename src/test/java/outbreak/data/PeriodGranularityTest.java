package outbreak.data;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class PeriodGranularityTest {

    @Test
    void testWeeklyAlignsToMonday() {
        LocalDate monday = LocalDate.of(2024, 1, 1);
        assertEquals(monday, PeriodGranularity.WEEKLY.align(monday));
        assertEquals(monday, PeriodGranularity.WEEKLY.align(LocalDate.of(2024, 1, 7)));
        assertEquals(monday.plusWeeks(1), PeriodGranularity.WEEKLY.align(LocalDate.of(2024, 1, 8)));
    }

    @Test
    void testNext() {
        assertEquals(LocalDate.of(2024, 1, 8), PeriodGranularity.WEEKLY.next(LocalDate.of(2024, 1, 1)));
        assertEquals(LocalDate.of(2024, 3, 1), PeriodGranularity.MONTHLY.next(LocalDate.of(2024, 2, 1)));
        assertEquals(LocalDate.of(2024, 3, 1), PeriodGranularity.DAILY.next(LocalDate.of(2024, 2, 29)));
    }
}
