package outbreak.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import outbreak.InsufficientHistoryException;
import outbreak.ModelFitException;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SARIMA estimation and forecasting")
class SarimaTest {

    private static final double DELTA = 1e-9;

    @Test
    @DisplayName("Random walk forecasts the last value with sqrt(h) standard errors")
    void testRandomWalk() {
        double[] y = {3, 5, 4, 6, 8, 7, 9, 12, 10, 11};
        Sarima rw = new Sarima(0, 1, 0, 0, 0, 0, 0, y, 100);

        double[] fc = rw.forecast(3);
        assertArrayEquals(new double[] {11, 11, 11}, fc, DELTA);

        // innovations are the first differences: 2, -1, 2, 2, -1, 2, 3, -2, 1
        double sigma2 = (4 + 1 + 4 + 4 + 1 + 4 + 9 + 4 + 1) / 9.0;
        assertEquals(sigma2, rw.getSigma2(), DELTA);
        assertEquals(-4.5 * (Math.log(2 * Math.PI * sigma2) + 1), rw.getLogLikelihood(), DELTA);
        double[] se = rw.forecastStandardErrors(3);
        for (int h = 0; h < 3; h++) {
            assertEquals(Math.sqrt(sigma2 * (h + 1)), se[h], DELTA);
        }
    }

    @Test
    @DisplayName("Seasonal differencing repeats the last season")
    void testSeasonalNaive() {
        double[] y = {1, 5, 3, 2, 1, 5, 3, 2, 1, 5, 3, 2};
        Sarima model = new Sarima(0, 0, 0, 0, 1, 0, 4, y, 100);

        assertArrayEquals(new double[] {1, 5, 3, 2, 1}, model.forecast(5), DELTA);
        assertEquals(0.0, model.getSigma2(), DELTA);
    }

    @Test
    @DisplayName("Recovers the coefficient of a simulated AR(1)")
    void testAr1Estimate() {
        Random rnd = new Random(17);
        double[] y = new double[600];
        for (int t = 1; t < y.length; t++) y[t] = 0.6 * y[t - 1] + rnd.nextGaussian();

        Sarima model = new Sarima(1, 0, 0, 0, 0, 0, 0, y, 500);

        assertEquals(0.6, model.getAr()[0], 0.1);
        assertEquals(1.0, model.getSigma2(), 0.2);
        double[] fc = model.forecast(2);
        assertEquals(model.getAr()[0] * y[y.length - 1], fc[0], 1e-6);
    }

    @Test
    @DisplayName("Seasonal fit is deterministic and intervals widen with the horizon")
    void testSeasonalFit() {
        double[] y = SeasonalSeries.asDoubles(SeasonalSeries.weekly(156, 4));

        Sarima first = new Sarima(1, 1, 1, 1, 1, 1, 52, y, 2000);
        Sarima second = new Sarima(1, 1, 1, 1, 1, 1, 52, y, 2000);

        double[] fc = first.forecast(8);
        assertArrayEquals(fc, second.forecast(8), 0.0);
        assertArrayEquals(first.getAr(), second.getAr(), 0.0);

        double[] se = first.forecastStandardErrors(8);
        for (int h = 0; h < 8; h++) {
            assertTrue(Double.isFinite(fc[h]));
            assertTrue(fc[h] > -20 && fc[h] < 60, "forecast " + fc[h] + " far off the series level");
            assertTrue(se[h] > 0);
            if (h > 0) assertTrue(se[h] >= se[h - 1]);
        }
        for (double c : first.getSeasonalMa()) {
            assertTrue(Math.abs(c) <= Sarima.BOUND + DELTA);
        }
    }

    @Test
    @DisplayName("Two seasons with one isolated spike fit seasonal terms that cancel the replayed drop")
    void testIsolatedSpikeTwoSeasonsBack() {
        double[] y = new double[104];
        y[51] = 50;

        Sarima model = new Sarima(1, 1, 1, 1, 1, 1, 52, y, 2000);

        // the residual at week 103 is -50(1 + Φ + Θ): only the seasonal coefficients can absorb it
        double seasonal = model.getSeasonalAr()[0] + model.getSeasonalMa()[0];
        assertEquals(-1.0, seasonal, 0.05);
        assertTrue(Math.abs(model.getMa()[0]) <= Sarima.BOUND + DELTA);
        for (double v : model.forecast(8)) {
            assertEquals(0.0, v, 1.0);
        }
    }

    @Test
    @DisplayName("Exhausting the evaluation budget is a model-fit failure")
    void testEvaluationBudget() {
        double[] y = SeasonalSeries.asDoubles(SeasonalSeries.weekly(156, 4));
        assertThrows(ModelFitException.class, () -> new Sarima(1, 1, 1, 1, 1, 1, 52, y, 5));
    }

    @Test
    @DisplayName("Too few observations after differencing")
    void testTooShortAfterDifferencing() {
        assertEquals(60, Sarima.minimumObservations(1, 1, 1, 1, 1, 1, 52));

        double[] y = SeasonalSeries.asDoubles(SeasonalSeries.weekly(59, 4));
        assertThrows(InsufficientHistoryException.class, () -> new Sarima(1, 1, 1, 1, 1, 1, 52, y, 2000));

        double[] enough = SeasonalSeries.asDoubles(SeasonalSeries.weekly(60, 4));
        Sarima model = new Sarima(1, 1, 1, 1, 1, 1, 52, enough, 2000);
        assertEquals(3, model.forecast(3).length);
    }

    @Test
    @DisplayName("ψ-weights of ARIMA(1,0,0) decay geometrically")
    void testPsiWeights() {
        Random rnd = new Random(3);
        double[] y = new double[300];
        for (int t = 1; t < y.length; t++) y[t] = 0.5 * y[t - 1] + rnd.nextGaussian();
        Sarima model = new Sarima(1, 0, 0, 0, 0, 0, 0, y, 500);

        double phi = model.getAr()[0];
        double[] psi = model.psiWeights(4);
        assertEquals(1.0, psi[0], DELTA);
        assertEquals(phi, psi[1], DELTA);
        assertEquals(phi * phi, psi[2], DELTA);
        assertEquals(phi * phi * phi, psi[3], DELTA);
    }

    @Test
    void testPolynomialProduct() {
        // (1 - 0.5B)(1 - 0.3B^2) = 1 - 0.5B - 0.3B^2 + 0.15B^3
        assertArrayEquals(new double[] {1, -0.5, -0.3, 0.15},
            Sarima.multiply(new double[] {1, -0.5}, new double[] {1, 0, -0.3}), DELTA);
    }
}
