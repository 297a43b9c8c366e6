package outbreak.ml;

/** What the SARIMA forecaster does with a series shorter than the minimum history. */
public enum ShortHistoryPolicy {
    /** Fail the pair with an insufficient-history error. */
    FAIL,
    /** Fit a non-seasonal linear trend instead. */
    TREND
}
