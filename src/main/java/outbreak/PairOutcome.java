package outbreak;

import outbreak.alert.Alert;
import outbreak.alert.Recommendation;
import outbreak.alert.Threshold;
import outbreak.data.SeriesKey;
import outbreak.ml.ForecastResult;

import java.util.List;
import java.util.Objects;

/** Everything the forecasting chain produced for one pair. */
public final class PairOutcome {

    private final SeriesKey key;
    private final ForecastResult forecast;
    private final Threshold threshold;
    private final List<Alert> alerts;
    private final List<Recommendation> recommendations;

    public PairOutcome(SeriesKey key, ForecastResult forecast, Threshold threshold,
                       List<Alert> alerts, List<Recommendation> recommendations) {
        if (alerts.size() != recommendations.size()) {
            throw new IllegalArgumentException("one recommendation per alert required");
        }
        this.key = Objects.requireNonNull(key, "key");
        this.forecast = Objects.requireNonNull(forecast, "forecast");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.alerts = List.copyOf(alerts);
        this.recommendations = List.copyOf(recommendations);
    }

    public SeriesKey getKey() { return key; }
    public ForecastResult getForecast() { return forecast; }
    public Threshold getThreshold() { return threshold; }
    public List<Alert> getAlerts() { return alerts; }
    public List<Recommendation> getRecommendations() { return recommendations; }

    public long triggeredCount() {
        return alerts.stream().filter(Alert::isTriggered).count();
    }
}
