package outbreak.ml;

import outbreak.data.SeriesKey;

import java.util.List;
import java.util.Objects;

/** Forecast of one (entity, disease) series over a fixed horizon, oldest period first. */
public final class ForecastResult {

    private final SeriesKey key;
    private final String model;
    private final List<ForecastPoint> points;

    public ForecastResult(SeriesKey key, String model, List<ForecastPoint> points) {
        this.key = Objects.requireNonNull(key, "key");
        this.model = Objects.requireNonNull(model, "model");
        this.points = List.copyOf(points);
    }

    public SeriesKey getKey() { return key; }
    /** Human-readable model name, e.g. {@code SARIMA(1,1,1)(1,1,1)52}. */
    public String getModel() { return model; }
    public List<ForecastPoint> getPoints() { return points; }

    public int horizon() {
        return points.size();
    }

    public double[] pointEstimates() {
        double[] out = new double[points.size()];
        for (int i = 0; i < out.length; i++) out[i] = points.get(i).getPointEstimate();
        return out;
    }
}
