package outbreak;

import outbreak.alert.Alert;
import outbreak.cluster.ClusterAssignment;
import outbreak.ml.ForecastPoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Result of one pipeline run.
 * <p>
 * A pair is either in {@link #getOutcomes()} or in {@link #getFailures()}, never both, so a
 * pair without data is never mistaken for a pair without risk.
 */
public final class OutbreakReport {

    private final ClusterAssignment clusters;
    private final String clusteringFailure;
    private final List<PairOutcome> outcomes;
    private final List<PairFailure> failures;

    public OutbreakReport(ClusterAssignment clusters, String clusteringFailure,
                          List<PairOutcome> outcomes, List<PairFailure> failures) {
        this.clusters = clusters;
        this.clusteringFailure = clusteringFailure;
        List<PairOutcome> o = new ArrayList<>(outcomes);
        o.sort(Comparator.comparing(PairOutcome::getKey));
        List<PairFailure> f = new ArrayList<>(failures);
        f.sort(Comparator.comparing(PairFailure::key));
        this.outcomes = List.copyOf(o);
        this.failures = List.copyOf(f);
    }

    /** Null when clustering failed; see {@link #getClusteringFailure()}. */
    public ClusterAssignment getClusters() { return clusters; }
    public String getClusteringFailure() { return clusteringFailure; }
    public List<PairOutcome> getOutcomes() { return outcomes; }
    public List<PairFailure> getFailures() { return failures; }

    public List<AlertRow> alertRows() {
        List<AlertRow> rows = new ArrayList<>();
        for (PairOutcome o : outcomes) {
            List<ForecastPoint> points = o.getForecast().getPoints();
            for (int i = 0; i < o.getAlerts().size(); i++) {
                Alert a = o.getAlerts().get(i);
                ForecastPoint fp = points.get(i);
                rows.add(new AlertRow(a.getEntity(), a.getDisease(), a.getPeriodStart(), a.getPredictedCases(),
                    fp.getLowerBound(), fp.getUpperBound(), o.getThreshold().getValue(), a.isTriggered(),
                    o.getRecommendations().get(i).getActionText()));
            }
        }
        return rows;
    }

    public List<ClusterRow> clusterRows() {
        List<ClusterRow> rows = new ArrayList<>();
        if (clusters == null) return rows;
        for (Map.Entry<String, Integer> e : clusters.asMap().entrySet()) {
            rows.add(new ClusterRow(e.getKey(), e.getValue()));
        }
        return rows;
    }
}
