package outbreak.ml;

import outbreak.data.SeriesSlice;

/**
 * Forecasts a bucketed series a fixed number of periods ahead.
 * <p>
 * Implementations keep no state between calls, so one instance may serve many pairs
 * concurrently.
 */
public interface Forecaster {

    /**
     * @param history gap-free history of one (entity, disease) pair
     * @param horizon number of future periods, at least 1
     * @throws outbreak.InsufficientHistoryException if the history cannot support the model
     * @throws outbreak.ModelFitException if estimation does not converge
     */
    ForecastResult forecast(SeriesSlice history, int horizon);
}
