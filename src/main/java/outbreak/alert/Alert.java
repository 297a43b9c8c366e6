package outbreak.alert;

import java.time.LocalDate;
import java.util.Objects;

public final class Alert {

    private final String entity;
    private final String disease;
    private final LocalDate periodStart;
    private final double predictedCases;
    private final boolean triggered;

    public Alert(String entity, String disease, LocalDate periodStart, double predictedCases, boolean triggered) {
        this.entity = Objects.requireNonNull(entity, "entity");
        this.disease = Objects.requireNonNull(disease, "disease");
        this.periodStart = Objects.requireNonNull(periodStart, "periodStart");
        this.predictedCases = predictedCases;
        this.triggered = triggered;
    }

    public String getEntity() { return entity; }
    public String getDisease() { return disease; }
    public LocalDate getPeriodStart() { return periodStart; }
    public double getPredictedCases() { return predictedCases; }
    public boolean isTriggered() { return triggered; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alert)) return false;
        Alert that = (Alert) o;
        return Double.compare(predictedCases, that.predictedCases) == 0 && triggered == that.triggered
            && entity.equals(that.entity) && disease.equals(that.disease) && periodStart.equals(that.periodStart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, disease, periodStart, predictedCases, triggered);
    }

    @Override
    public String toString() {
        return (triggered ? "ALERT " : "ok ") + entity + "/" + disease + " " + periodStart
            + String.format(" predicted=%.2f", predictedCases);
    }
}
