package outbreak;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import outbreak.alert.Alert;
import outbreak.alert.AlertEngine;
import outbreak.alert.Recommendation;
import outbreak.alert.Recommender;
import outbreak.alert.Threshold;
import outbreak.cluster.ClusterAssignment;
import outbreak.cluster.Clusterer;
import outbreak.cluster.EntityProfile;
import outbreak.cluster.ProfileBuilder;
import outbreak.data.Aggregator;
import outbreak.data.BucketedSeries;
import outbreak.data.CaseRecord;
import outbreak.data.SeriesKey;
import outbreak.data.SeriesSlice;
import outbreak.ml.ForecastResult;
import outbreak.ml.Forecaster;
import outbreak.ml.Forecasters;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the analysis: records are bucketed once, then entity clustering and the per-pair
 * forecast → threshold → alert → recommendation chains consume the same table.
 * <p>
 * Pairs are independent and run on a fixed worker pool while clustering runs on the
 * calling thread. A pair that fails with an {@link OutbreakException} becomes a
 * {@link PairFailure} and does not affect the others.
 */
public class OutbreakPipeline {

    private static final Logger log = LoggerFactory.getLogger(OutbreakPipeline.class);

    private final OutbreakConfig config;
    private final Aggregator aggregator;
    private final ProfileBuilder profileBuilder = new ProfileBuilder();
    private final Clusterer clusterer;
    private final Forecaster forecaster;
    private final AlertEngine alertEngine;
    private final Recommender recommender = new Recommender();

    public OutbreakPipeline(OutbreakConfig config) {
        this(config, Forecasters.create(config));
    }

    /** Uses {@code forecaster} in place of the configured strategy. */
    public OutbreakPipeline(OutbreakConfig config, Forecaster forecaster) {
        this.config = config.validate();
        this.aggregator = new Aggregator(config.getGranularity());
        this.clusterer = new Clusterer(config.getClusterCount(), config.getClusterMaxIterations(), config.getClusterSeed());
        this.forecaster = forecaster;
        this.alertEngine = new AlertEngine(config.getAlertZ());
    }

    public BucketedSeries aggregate(Collection<CaseRecord> records) {
        return aggregator.aggregate(records);
    }

    /** @param pairs pairs to forecast; empty means every pair in the data */
    public OutbreakReport run(Collection<CaseRecord> records, Collection<SeriesKey> pairs) {
        return analyze(aggregate(records), pairs);
    }

    public OutbreakReport analyze(BucketedSeries series, Collection<SeriesKey> pairs) {
        List<SeriesKey> selected = new ArrayList<>(new LinkedHashSet<>(pairs.isEmpty() ? series.keys() : pairs));
        List<PairOutcome> outcomes = new ArrayList<>();
        List<PairFailure> failures = new ArrayList<>();

        ExecutorService pool = Executors.newFixedThreadPool(Math.max(1, Math.min(config.getWorkerThreads(), selected.size())));
        try {
            List<Future<PairResult>> futures = new ArrayList<>(selected.size());
            for (SeriesKey key : selected) {
                futures.add(pool.submit(() -> runPair(series, key)));
            }

            ClusterAssignment clusters = null;
            String clusteringFailure = null;
            try {
                clusters = cluster(series);
            } catch (OutbreakException e) {
                clusteringFailure = e.getKind() + ": " + e.getMessage();
                log.warn("Clustering skipped: {}", clusteringFailure);
            }

            for (Future<PairResult> f : futures) {
                PairResult r = await(f);
                if (r.outcome != null) outcomes.add(r.outcome);
                else failures.add(r.failure);
            }
            log.info("Forecast {} pairs: {} succeeded, {} skipped or failed, {} triggered periods",
                selected.size(), outcomes.size(), failures.size(),
                outcomes.stream().mapToLong(PairOutcome::triggeredCount).sum());
            return new OutbreakReport(clusters, clusteringFailure, outcomes, failures);
        } finally {
            pool.shutdownNow();
        }
    }

    public ClusterAssignment cluster(BucketedSeries series) {
        List<String> diseases = config.getDiseases().isEmpty()
            ? new ArrayList<>(series.diseases())
            : config.getDiseases();
        EntityProfile profile = profileBuilder.build(series, diseases);
        return clusterer.cluster(profile);
    }

    /**
     * Forecast chain for one pair.
     *
     * @throws OutbreakException when the pair has no usable history or the model cannot be fit
     */
    public PairOutcome forecastPair(BucketedSeries series, SeriesKey key) {
        SeriesSlice history = series.slice(key);
        if (history == null || history.isEmpty()) {
            throw new InsufficientHistoryException(key + ": no records");
        }
        ForecastResult forecast = forecaster.forecast(history, config.getForecastHorizon());
        Threshold threshold = alertEngine.threshold(history);
        List<Alert> alerts = alertEngine.evaluate(threshold, forecast);
        List<Recommendation> recommendations = new ArrayList<>(alerts.size());
        for (Alert a : alerts) recommendations.add(recommender.recommend(a));
        log.debug("{}: {} threshold {}", key, forecast.getModel(), threshold);
        return new PairOutcome(key, forecast, threshold, alerts, recommendations);
    }

    private PairResult runPair(BucketedSeries series, SeriesKey key) {
        SeriesSlice history = series.slice(key);
        if (history != null && !history.isEmpty() && history.totalCount() == 0) {
            log.warn("Skipping {}: no reported cases", key);
            return PairResult.failed(new PairFailure(key, FailureKind.NO_REPORTED_CASES,
                "no cases reported in " + history.size() + " periods"));
        }
        try {
            return PairResult.ok(forecastPair(series, key));
        } catch (OutbreakException e) {
            log.warn("Skipping {}: {} {}", key, e.getKind(), e.getMessage());
            return PairResult.failed(new PairFailure(key, e.getKind(), e.getMessage()));
        }
    }

    private static PairResult await(Future<PairResult> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for forecasts", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Forecast task failed", cause);
        }
    }

    public OutbreakConfig getConfig() {
        return config;
    }

    private static final class PairResult {
        final PairOutcome outcome;
        final PairFailure failure;

        private PairResult(PairOutcome outcome, PairFailure failure) {
            this.outcome = outcome;
            this.failure = failure;
        }

        static PairResult ok(PairOutcome outcome) {
            return new PairResult(outcome, null);
        }

        static PairResult failed(PairFailure failure) {
            return new PairResult(null, failure);
        }
    }
}
