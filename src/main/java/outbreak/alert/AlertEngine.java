package outbreak.alert;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import outbreak.InsufficientHistoryException;
import outbreak.data.SeriesSlice;
import outbreak.ml.ForecastPoint;
import outbreak.ml.ForecastResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags forecast periods whose point estimate exceeds the historical mean by more than
 * {@code z} sample standard deviations.
 * <p>
 * The threshold comes from the raw history with no seasonal or trend adjustment.
 */
public class AlertEngine {

    private final double z;

    public AlertEngine(double z) {
        if (Double.isNaN(z) || Double.isInfinite(z) || z < 0) {
            throw new IllegalArgumentException("z must be a finite value >= 0, got " + z);
        }
        this.z = z;
    }

    public Threshold threshold(SeriesSlice history) {
        if (history.isEmpty()) {
            throw new InsufficientHistoryException(history.getKey() + ": no history to derive a threshold");
        }
        double[] values = history.values();
        double mean = new Mean().evaluate(values);
        // sample (n - 1) deviation; a single period has none
        double sd = values.length > 1 ? new StandardDeviation(true).evaluate(values) : 0.0;
        return new Threshold(mean, sd, z);
    }

    public List<Alert> evaluate(SeriesSlice history, ForecastResult forecast) {
        return evaluate(threshold(history), forecast);
    }

    public List<Alert> evaluate(Threshold threshold, ForecastResult forecast) {
        List<Alert> out = new ArrayList<>(forecast.horizon());
        String entity = forecast.getKey().getEntity();
        String disease = forecast.getKey().getDisease();
        for (ForecastPoint fp : forecast.getPoints()) {
            out.add(new Alert(entity, disease, fp.getPeriodStart(), fp.getPointEstimate(),
                threshold.isExceededBy(fp.getPointEstimate())));
        }
        return out;
    }

    public double getZ() {
        return z;
    }
}
