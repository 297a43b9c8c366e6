package outbreak.ml;

import org.apache.commons.math3.distribution.NormalDistribution;
import outbreak.InsufficientHistoryException;
import outbreak.data.SeriesSlice;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Non-seasonal fallback: an OLS linear trend on the period index, with prediction intervals
 * from the regression's prediction standard error.
 */
public class TrendForecaster implements Forecaster {

    static final int MIN_POINTS = 3;

    private final double confidenceLevel;

    public TrendForecaster(double confidenceLevel) {
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new IllegalArgumentException("confidenceLevel must be in (0, 1)");
        }
        this.confidenceLevel = confidenceLevel;
    }

    @Override
    public ForecastResult forecast(SeriesSlice history, int horizon) {
        if (horizon < 1) throw new IllegalArgumentException("horizon must be >= 1");
        int n = history.size();
        if (n < MIN_POINTS) {
            throw new InsufficientHistoryException(history.getKey() + ": trend needs " + MIN_POINTS
                + " periods, got " + n);
        }
        double[] y = history.values();
        LinearRegression lr = new LinearRegression(timeIndex(0, n), y);
        double z = quantile(confidenceLevel);

        List<LocalDate> periods = history.futurePeriods(horizon);
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int h = 0; h < horizon; h++) {
            double[] x = {n + h};
            double mean = lr.predict(x);
            double se = lr.predictionStandardError(x);
            points.add(new ForecastPoint(periods.get(h), mean, mean - z * se, mean + z * se));
        }
        return new ForecastResult(history.getKey(), "TREND", points);
    }

    private static double[][] timeIndex(int from, int count) {
        double[][] X = new double[count][1];
        for (int i = 0; i < count; i++) X[i][0] = from + i;
        return X;
    }

    /** Two-sided standard normal quantile for the given confidence level. */
    static double quantile(double confidenceLevel) {
        return new NormalDistribution().inverseCumulativeProbability(0.5 + confidenceLevel / 2);
    }
}
