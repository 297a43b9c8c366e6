package outbreak.ml;

import outbreak.InsufficientHistoryException;
import outbreak.data.SeriesSlice;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Lightweight fallback: each period is forecast as the mean of up to {@code window} prior
 * periods, never its own value. Future periods past the first reuse earlier forecasts in
 * place of unobserved values. No interval is produced.
 */
public class MovingAverageForecaster implements Forecaster {

    private final int window;

    public MovingAverageForecaster(int window) {
        if (window < 1) throw new IllegalArgumentException("window must be >= 1, got " + window);
        this.window = window;
    }

    @Override
    public ForecastResult forecast(SeriesSlice history, int horizon) {
        if (horizon < 1) throw new IllegalArgumentException("horizon must be >= 1");
        if (history.isEmpty()) {
            throw new InsufficientHistoryException(history.getKey() + ": no observed periods");
        }
        double[] values = history.values();
        int n = values.length;
        double[] ext = Arrays.copyOf(values, n + horizon);
        List<LocalDate> periods = history.futurePeriods(horizon);
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int h = 0; h < horizon; h++) {
            ext[n + h] = meanBefore(ext, n + h);
            points.add(ForecastPoint.withoutInterval(periods.get(h), ext[n + h]));
        }
        return new ForecastResult(history.getKey(), "MOVING_AVERAGE(" + window + ")", points);
    }

    /**
     * In-sample one-step forecasts: {@code out[t]} is the mean of up to {@code window} values
     * before t. {@code out[0]} has no prior value and is NaN.
     */
    public double[] trailingMeans(double[] values) {
        double[] out = new double[values.length];
        for (int t = 0; t < values.length; t++) {
            out[t] = t == 0 ? Double.NaN : meanBefore(values, t);
        }
        return out;
    }

    private double meanBefore(double[] x, int t) {
        int from = Math.max(0, t - window);
        double sum = 0;
        for (int i = from; i < t; i++) sum += x[i];
        return sum / (t - from);
    }
}
