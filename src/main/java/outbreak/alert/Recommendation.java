package outbreak.alert;

import java.time.LocalDate;
import java.util.Objects;

public final class Recommendation {

    private final String entity;
    private final String disease;
    private final LocalDate periodStart;
    private final String actionText;

    public Recommendation(String entity, String disease, LocalDate periodStart, String actionText) {
        this.entity = Objects.requireNonNull(entity, "entity");
        this.disease = Objects.requireNonNull(disease, "disease");
        this.periodStart = Objects.requireNonNull(periodStart, "periodStart");
        this.actionText = Objects.requireNonNull(actionText, "actionText");
    }

    public String getEntity() { return entity; }
    public String getDisease() { return disease; }
    public LocalDate getPeriodStart() { return periodStart; }
    public String getActionText() { return actionText; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Recommendation)) return false;
        Recommendation that = (Recommendation) o;
        return entity.equals(that.entity) && disease.equals(that.disease)
            && periodStart.equals(that.periodStart) && actionText.equals(that.actionText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, disease, periodStart, actionText);
    }

    @Override
    public String toString() {
        return periodStart + " " + actionText;
    }
}
