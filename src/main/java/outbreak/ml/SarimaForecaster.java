package outbreak.ml;

import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import outbreak.ConfigurationException;
import outbreak.InsufficientHistoryException;
import outbreak.OutbreakConfig;
import outbreak.data.SeriesSlice;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Primary forecaster: fits a fresh {@link Sarima} to each series and turns its standard
 * errors into symmetric intervals at the configured confidence level.
 * <p>
 * A history shorter than {@code minHistory} either fails or, when the short-history policy
 * is {@link ShortHistoryPolicy#TREND}, is handed to a {@link TrendForecaster}. A constant
 * history always fails: it carries no information to fit.
 */
public class SarimaForecaster implements Forecaster {

    private static final Logger log = LoggerFactory.getLogger(SarimaForecaster.class);

    private final OutbreakConfig config;
    private final TrendForecaster trend;
    private final double z;

    public SarimaForecaster(OutbreakConfig config) {
        this.config = config.validate();
        this.trend = new TrendForecaster(config.getConfidenceLevel());
        this.z = TrendForecaster.quantile(config.getConfidenceLevel());
    }

    @Override
    public ForecastResult forecast(SeriesSlice history, int horizon) {
        if (horizon < 1) throw new IllegalArgumentException("horizon must be >= 1");
        if (history.getGranularity() != config.getGranularity()) {
            throw new ConfigurationException(history.getKey() + " is bucketed " + history.getGranularity()
                + " but the model is configured for " + config.getGranularity());
        }
        double[] values = history.values();
        if (values.length > 0 && new Variance().evaluate(values) == 0) {
            throw new InsufficientHistoryException(history.getKey() + ": constant history of "
                + values.length + " periods, nothing to fit");
        }
        int minHistory = config.getMinHistory();
        if (values.length < minHistory) {
            if (config.getShortHistoryPolicy() == ShortHistoryPolicy.TREND) {
                log.debug("{}: {} periods < {}, using trend fallback", history.getKey(), values.length, minHistory);
                return trend.forecast(history, horizon);
            }
            throw new InsufficientHistoryException(history.getKey() + ": " + values.length
                + " periods, seasonal model needs " + minHistory);
        }

        Sarima model = new Sarima(config.getP(), config.getD(), config.getQ(),
            config.getSeasonalP(), config.getSeasonalD(), config.getSeasonalQ(),
            config.getSeasonalPeriod(), values, config.getOptimizerMaxEvaluations());
        double[] mean = model.forecast(horizon);
        double[] se = model.forecastStandardErrors(horizon);

        List<LocalDate> periods = history.futurePeriods(horizon);
        List<ForecastPoint> points = new ArrayList<>(horizon);
        for (int h = 0; h < horizon; h++) {
            points.add(new ForecastPoint(periods.get(h), mean[h], mean[h] - z * se[h], mean[h] + z * se[h]));
        }
        return new ForecastResult(history.getKey(), model.toString(), points);
    }
}
