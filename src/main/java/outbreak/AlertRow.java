package outbreak;

import java.time.LocalDate;

/** Flat, serializable view of one alert with its forecast interval and action. */
public final class AlertRow {

    private final String entity;
    private final String disease;
    private final LocalDate periodStart;
    private final double predictedCases;
    private final Double lowerBound;
    private final Double upperBound;
    private final double threshold;
    private final boolean triggered;
    private final String actionText;

    public AlertRow(String entity, String disease, LocalDate periodStart, double predictedCases,
                    Double lowerBound, Double upperBound, double threshold, boolean triggered, String actionText) {
        this.entity = entity;
        this.disease = disease;
        this.periodStart = periodStart;
        this.predictedCases = predictedCases;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.threshold = threshold;
        this.triggered = triggered;
        this.actionText = actionText;
    }

    public String getEntity() { return entity; }
    public String getDisease() { return disease; }
    public LocalDate getPeriodStart() { return periodStart; }
    public double getPredictedCases() { return predictedCases; }
    public Double getLowerBound() { return lowerBound; }
    public Double getUpperBound() { return upperBound; }
    public double getThreshold() { return threshold; }
    public boolean isTriggered() { return triggered; }
    public String getActionText() { return actionText; }
}
