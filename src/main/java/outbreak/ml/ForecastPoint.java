package outbreak.ml;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One forecast period. The estimate is not floored at zero and a negative lower bound is
 * kept as computed; bounds are null for models without an interval.
 */
public final class ForecastPoint {

    private final LocalDate periodStart;
    private final double pointEstimate;
    private final Double lowerBound;
    private final Double upperBound;

    public ForecastPoint(LocalDate periodStart, double pointEstimate, Double lowerBound, Double upperBound) {
        this.periodStart = Objects.requireNonNull(periodStart, "periodStart");
        if ((lowerBound == null) != (upperBound == null)) {
            throw new IllegalArgumentException("interval needs both bounds or neither");
        }
        this.pointEstimate = pointEstimate;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public static ForecastPoint withoutInterval(LocalDate periodStart, double pointEstimate) {
        return new ForecastPoint(periodStart, pointEstimate, null, null);
    }

    public LocalDate getPeriodStart() { return periodStart; }
    public double getPointEstimate() { return pointEstimate; }
    public Double getLowerBound() { return lowerBound; }
    public Double getUpperBound() { return upperBound; }

    public boolean hasInterval() {
        return lowerBound != null;
    }

    @Override
    public String toString() {
        return hasInterval()
            ? String.format("%s: %.2f [%.2f, %.2f]", periodStart, pointEstimate, lowerBound, upperBound)
            : String.format("%s: %.2f", periodStart, pointEstimate);
    }
}
