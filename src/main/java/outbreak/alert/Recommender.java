package outbreak.alert;

/** Maps an alert outcome to the action message shown to health officials. */
public class Recommender {

    public String actionText(String disease, String entity, boolean triggered) {
        if (triggered) {
            return "High risk of " + disease + " outbreak in " + entity
                + ". Recommend vaccination and awareness drives.";
        }
        return "No immediate threat of " + disease + " outbreak in " + entity + ".";
    }

    public Recommendation recommend(Alert alert) {
        return new Recommendation(alert.getEntity(), alert.getDisease(), alert.getPeriodStart(),
            actionText(alert.getDisease(), alert.getEntity(), alert.isTriggered()));
    }
}
