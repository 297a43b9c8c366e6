package outbreak.ml;

import outbreak.OutbreakConfig;

/** Picks the {@link Forecaster} named by the configured strategy. */
public final class Forecasters {

    private Forecasters() { }

    public static Forecaster create(OutbreakConfig config) {
        switch (config.getForecastStrategy()) {
            case MOVING_AVERAGE:
                return new MovingAverageForecaster(config.getMovingAverageWindow());
            case SARIMA:
            default:
                return new SarimaForecaster(config);
        }
    }
}
