package outbreak.ml;

/** Which {@link Forecaster} the pipeline runs per pair. */
public enum ForecastStrategy {
    /** Seasonal ARIMA with confidence intervals. */
    SARIMA,
    /** Trailing moving average, point estimates only. */
    MOVING_AVERAGE
}
