package outbreak.cluster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import outbreak.ConfigurationException;
import outbreak.InsufficientDataException;
import outbreak.data.Aggregator;
import outbreak.data.BucketedSeries;
import outbreak.data.CaseRecord;
import outbreak.data.PeriodGranularity;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Entity profiles")
class ProfileBuilderTest {

    private static final double DELTA = 1e-9;

    private final ProfileBuilder builder = new ProfileBuilder();

    private static BucketedSeries series(CaseRecord... records) {
        return new Aggregator(PeriodGranularity.WEEKLY).aggregate(List.of(records));
    }

    @Test
    @DisplayName("Sums every period of each disease")
    void testSumsAcrossWindow() {
        BucketedSeries s = series(
            new CaseRecord("Lagos", LocalDate.of(2024, 1, 1), "cholera", 3),
            new CaseRecord("Lagos", LocalDate.of(2024, 2, 1), "cholera", 4),
            new CaseRecord("Lagos", LocalDate.of(2024, 1, 9), "measles", 2),
            new CaseRecord("Kano", LocalDate.of(2024, 1, 9), "measles", 9));

        EntityProfile profile = builder.build(s, List.of("cholera", "measles"));

        assertEquals(List.of("Kano", "Lagos"), profile.entities());
        assertArrayEquals(new double[] {7, 2}, profile.vector("Lagos"), DELTA);
        assertArrayEquals(new double[] {0, 9}, profile.vector("Kano"), DELTA, "missing disease is zero");
    }

    @Test
    @DisplayName("A disease nobody reported is an all-zero column, not an error")
    void testAbsentDiseaseColumn() {
        BucketedSeries s = series(new CaseRecord("Lagos", LocalDate.of(2024, 1, 1), "cholera", 3));

        EntityProfile profile = builder.build(s, List.of("ebola", "cholera"));

        assertEquals(0.0, profile.value("Lagos", "ebola"), DELTA);
        assertEquals(3.0, profile.value("Lagos", "cholera"), DELTA);
    }

    @Test
    void testEmptyEntitySetFails() {
        assertThrows(InsufficientDataException.class, () -> builder.build(series(), List.of("cholera")));
    }

    @Test
    void testDuplicateDiseaseOrderFails() {
        BucketedSeries s = series(new CaseRecord("Lagos", LocalDate.of(2024, 1, 1), "cholera", 3));
        assertThrows(ConfigurationException.class, () -> builder.build(s, List.of("cholera", "cholera")));
    }
}
