package outbreak;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import outbreak.data.CaseRecord;
import outbreak.data.SeriesKey;
import outbreak.ml.ForecastStrategy;
import outbreak.ml.Forecaster;
import outbreak.ml.MovingAverageForecaster;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Pipeline")
class OutbreakPipelineTest {

    private static final LocalDate START = LocalDate.of(2021, 1, 4);

    private static void weekly(List<CaseRecord> out, String entity, String disease, long... counts) {
        for (int i = 0; i < counts.length; i++) {
            out.add(new CaseRecord(entity, START.plusWeeks(i).plusDays(2), disease, counts[i]));
        }
    }

    private static long[] seasonal(int weeks, long seed) {
        Random rnd = new Random(seed);
        long[] out = new long[weeks];
        for (int t = 0; t < weeks; t++) {
            out[t] = Math.max(0, Math.round(15 + 8 * Math.sin(2 * Math.PI * t / 52.0) + rnd.nextGaussian() * 2));
        }
        return out;
    }

    private static long[] constant(int weeks, long value) {
        long[] out = new long[weeks];
        Arrays.fill(out, value);
        return out;
    }

    private static List<CaseRecord> mixedRecords() {
        List<CaseRecord> records = new ArrayList<>();
        weekly(records, "Lagos", "cholera", seasonal(156, 1));
        weekly(records, "Kano", "cholera", seasonal(50, 2));
        weekly(records, "Kano", "measles", constant(120, 5));
        weekly(records, "Oyo", "ebola", constant(60, 0));
        weekly(records, "Oyo", "cholera", seasonal(110, 3));
        return records;
    }

    private static Map<SeriesKey, PairFailure> failuresByKey(OutbreakReport report) {
        return report.getFailures().stream().collect(Collectors.toMap(PairFailure::key, Function.identity()));
    }

    @Test
    @DisplayName("Failing pairs are reported individually while the others complete")
    void testPartialFailure() {
        OutbreakConfig config = OutbreakConfig.defaults().clusterCount(2).workerThreads(3);

        OutbreakReport report = new OutbreakPipeline(config).run(mixedRecords(), List.of());

        List<SeriesKey> succeeded = report.getOutcomes().stream().map(PairOutcome::getKey).collect(Collectors.toList());
        assertEquals(List.of(new SeriesKey("Lagos", "cholera"), new SeriesKey("Oyo", "cholera")), succeeded);
        for (PairOutcome o : report.getOutcomes()) {
            assertEquals(8, o.getAlerts().size());
            assertEquals(8, o.getRecommendations().size());
        }

        Map<SeriesKey, PairFailure> failures = failuresByKey(report);
        assertEquals(3, failures.size());
        assertEquals(FailureKind.INSUFFICIENT_HISTORY, failures.get(new SeriesKey("Kano", "cholera")).getKind(),
            "50 weeks is below two seasonal cycles");
        assertEquals(FailureKind.INSUFFICIENT_HISTORY, failures.get(new SeriesKey("Kano", "measles")).getKind(),
            "constant series is degenerate");
        assertEquals(FailureKind.NO_REPORTED_CASES, failures.get(new SeriesKey("Oyo", "ebola")).getKind());

        assertNotNull(report.getClusters());
        assertEquals(3, report.clusterRows().size());
        assertEquals(16, report.alertRows().size());
    }

    @Test
    @DisplayName("A requested pair without records is a failure, not a quiet result")
    void testUnknownPair() {
        OutbreakConfig config = OutbreakConfig.defaults().clusterCount(2).forecastStrategy(ForecastStrategy.MOVING_AVERAGE);
        SeriesKey unknown = new SeriesKey("Abia", "cholera");

        OutbreakReport report = new OutbreakPipeline(config)
            .run(mixedRecords(), List.of(unknown, new SeriesKey("Lagos", "cholera")));

        assertEquals(1, report.getOutcomes().size());
        assertEquals(1, report.getFailures().size());
        assertEquals(unknown, report.getFailures().get(0).key());
        assertEquals(FailureKind.INSUFFICIENT_HISTORY, report.getFailures().get(0).getKind());
    }

    @Test
    @DisplayName("Clustering failure leaves the forecasts intact")
    void testClusteringFailure() {
        OutbreakConfig config = OutbreakConfig.defaults().clusterCount(5).forecastStrategy(ForecastStrategy.MOVING_AVERAGE);

        OutbreakReport report = new OutbreakPipeline(config).run(mixedRecords(), List.of());

        assertNull(report.getClusters());
        assertTrue(report.getClusteringFailure().startsWith("INSUFFICIENT_DATA"));
        assertTrue(report.clusterRows().isEmpty());
        assertFalse(report.getOutcomes().isEmpty());
    }

    @Test
    @DisplayName("Flat alert rows carry forecast, threshold and action")
    void testAlertRows() {
        List<CaseRecord> records = new ArrayList<>();
        long[] lagos = new long[20];
        lagos[18] = 10;
        lagos[19] = 30;
        weekly(records, "Lagos", "cholera", lagos);
        weekly(records, "Kano", "cholera", 1, 0, 2, 1);
        OutbreakConfig config = OutbreakConfig.defaults().clusterCount(2)
            .forecastStrategy(ForecastStrategy.MOVING_AVERAGE).forecastHorizon(2);

        OutbreakReport report = new OutbreakPipeline(config).run(records, List.of(new SeriesKey("Lagos", "cholera")));

        List<AlertRow> rows = report.alertRows();
        assertEquals(2, rows.size());
        AlertRow first = rows.get(0);
        assertEquals("Lagos", first.getEntity());
        assertEquals(START.plusWeeks(20), first.getPeriodStart());
        assertEquals(20.0, first.getPredictedCases(), 1e-9);
        assertNull(first.getLowerBound());
        assertTrue(first.isTriggered(), "20 exceeds mean 2 + 2 sd");
        assertTrue(first.getActionText().startsWith("High risk of cholera outbreak in Lagos"));
    }

    @Test
    @DisplayName("Model-fit failures are isolated to their pair")
    void testModelFitIsolated() {
        MovingAverageForecaster fallback = new MovingAverageForecaster(2);
        Forecaster flaky = (history, horizon) -> {
            if (history.getKey().getEntity().equals("Lagos")) {
                throw new ModelFitException("did not converge");
            }
            return fallback.forecast(history, horizon);
        };
        OutbreakConfig config = OutbreakConfig.defaults().clusterCount(2);

        OutbreakReport report = new OutbreakPipeline(config, flaky).run(mixedRecords(), List.of());

        assertEquals(FailureKind.MODEL_FIT, failuresByKey(report).get(new SeriesKey("Lagos", "cholera")).getKind());
        assertTrue(report.getOutcomes().stream().anyMatch(o -> o.getKey().getEntity().equals("Kano")));
    }

    @Test
    @DisplayName("Programming errors are not turned into pair failures")
    void testUnexpectedErrorPropagates() {
        Forecaster broken = (history, horizon) -> {
            throw new IllegalStateException("bug");
        };
        OutbreakPipeline pipeline = new OutbreakPipeline(OutbreakConfig.defaults().clusterCount(2), broken);

        assertThrows(IllegalStateException.class, () -> pipeline.run(mixedRecords(), List.of()));
    }

    @Test
    void testInvalidConfigurationRejected() {
        assertThrows(ConfigurationException.class, () -> new OutbreakPipeline(OutbreakConfig.defaults().forecastHorizon(0)));
    }
}
