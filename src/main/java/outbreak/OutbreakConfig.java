package outbreak;

import com.google.gson.JsonParseException;
import outbreak.data.PeriodGranularity;
import outbreak.io.Json;
import outbreak.ml.ForecastStrategy;
import outbreak.ml.Sarima;
import outbreak.ml.ShortHistoryPolicy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Tunables of the analytical pipeline.
 * <p>
 * Defaults are set here; a JSON document may override any subset of fields, e.g.
 * <pre>{"clusterCount": 4, "order": [2,1,1], "shortHistoryPolicy": "TREND"}</pre>
 * Components call {@link #validate()} when they are constructed.
 */
public class OutbreakConfig {

    private PeriodGranularity granularity = PeriodGranularity.WEEKLY;
    private int clusterCount = 3;
    private long clusterSeed = 42L;
    private int clusterMaxIterations = 300;
    private int forecastHorizon = 8;
    private int seasonalPeriod = 52;
    /** Non-seasonal (p, d, q). */
    private int[] order = {1, 1, 1};
    /** Seasonal (P, D, Q); the period is {@link #seasonalPeriod}. */
    private int[] seasonalOrder = {1, 1, 1};
    private double alertZ = 2.0;
    /** Null means two full seasonal cycles. */
    private Integer minHistory;
    private ShortHistoryPolicy shortHistoryPolicy = ShortHistoryPolicy.FAIL;
    private ForecastStrategy forecastStrategy = ForecastStrategy.SARIMA;
    private int movingAverageWindow = 2;
    private double confidenceLevel = 0.95;
    private int optimizerMaxEvaluations = 2000;
    private int workerThreads = Runtime.getRuntime().availableProcessors();
    /** Profile column order; empty means every disease present in the data, sorted. */
    private List<String> diseases = new ArrayList<>();

    public static OutbreakConfig defaults() {
        return new OutbreakConfig();
    }

    public static OutbreakConfig fromJson(String json) {
        if (json == null || json.isBlank()) return defaults();
        OutbreakConfig cfg;
        try {
            cfg = Json.GSON.fromJson(json, OutbreakConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigurationException("Invalid configuration JSON: " + e.getMessage(), e);
        }
        if (cfg == null) return defaults();
        cfg.validate();
        return cfg;
    }

    public static OutbreakConfig load(Path path) throws IOException {
        return fromJson(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    /** Throws {@link ConfigurationException} describing the first invalid field. */
    public OutbreakConfig validate() {
        if (granularity == null) throw new ConfigurationException("granularity is required");
        if (clusterCount < 1) throw new ConfigurationException("clusterCount must be >= 1, got " + clusterCount);
        if (clusterMaxIterations < 1) throw new ConfigurationException("clusterMaxIterations must be >= 1");
        if (forecastHorizon < 1) throw new ConfigurationException("forecastHorizon must be >= 1, got " + forecastHorizon);
        if (seasonalPeriod < 2) throw new ConfigurationException("seasonalPeriod must be >= 2, got " + seasonalPeriod);
        checkOrder("order", order);
        checkOrder("seasonalOrder", seasonalOrder);
        if (Double.isNaN(alertZ) || Double.isInfinite(alertZ) || alertZ < 0) {
            throw new ConfigurationException("alertZ must be a finite value >= 0, got " + alertZ);
        }
        int required = minimumModelHistory();
        if (minHistory != null && minHistory < required) {
            throw new ConfigurationException("minHistory " + minHistory + " is below the " + required
                + " periods the configured orders need");
        }
        if (shortHistoryPolicy == null) throw new ConfigurationException("shortHistoryPolicy is required");
        if (forecastStrategy == null) throw new ConfigurationException("forecastStrategy is required");
        if (movingAverageWindow < 1) throw new ConfigurationException("movingAverageWindow must be >= 1");
        if (!(confidenceLevel > 0 && confidenceLevel < 1)) {
            throw new ConfigurationException("confidenceLevel must be in (0, 1), got " + confidenceLevel);
        }
        if (optimizerMaxEvaluations < 1) throw new ConfigurationException("optimizerMaxEvaluations must be >= 1");
        if (workerThreads < 1) throw new ConfigurationException("workerThreads must be >= 1");
        if (diseases == null) throw new ConfigurationException("diseases must be a list (possibly empty)");
        if (new HashSet<>(diseases).size() != diseases.size()) {
            throw new ConfigurationException("diseases contains duplicates: " + diseases);
        }
        return this;
    }

    private static void checkOrder(String name, int[] o) {
        if (o == null || o.length != 3) throw new ConfigurationException(name + " must have exactly 3 entries");
        for (int v : o) {
            if (v < 0) throw new ConfigurationException(name + " entries must be >= 0");
        }
    }

    private int minimumModelHistory() {
        return Sarima.minimumObservations(order[0], order[1], order[2],
            seasonalOrder[0], seasonalOrder[1], seasonalOrder[2], seasonalPeriod);
    }

    public PeriodGranularity getGranularity() { return granularity; }
    public int getClusterCount() { return clusterCount; }
    public long getClusterSeed() { return clusterSeed; }
    public int getClusterMaxIterations() { return clusterMaxIterations; }
    public int getForecastHorizon() { return forecastHorizon; }
    public int getSeasonalPeriod() { return seasonalPeriod; }
    public int getP() { return order[0]; }
    public int getD() { return order[1]; }
    public int getQ() { return order[2]; }
    public int getSeasonalP() { return seasonalOrder[0]; }
    public int getSeasonalD() { return seasonalOrder[1]; }
    public int getSeasonalQ() { return seasonalOrder[2]; }
    public double getAlertZ() { return alertZ; }
    public ShortHistoryPolicy getShortHistoryPolicy() { return shortHistoryPolicy; }
    public ForecastStrategy getForecastStrategy() { return forecastStrategy; }
    public int getMovingAverageWindow() { return movingAverageWindow; }
    public double getConfidenceLevel() { return confidenceLevel; }
    public int getOptimizerMaxEvaluations() { return optimizerMaxEvaluations; }
    public int getWorkerThreads() { return workerThreads; }
    public List<String> getDiseases() { return List.copyOf(diseases); }

    public int getMinHistory() {
        return minHistory != null ? minHistory : Math.max(2 * seasonalPeriod, minimumModelHistory());
    }

    public OutbreakConfig granularity(PeriodGranularity v) { this.granularity = v; return this; }
    public OutbreakConfig clusterCount(int v) { this.clusterCount = v; return this; }
    public OutbreakConfig clusterSeed(long v) { this.clusterSeed = v; return this; }
    public OutbreakConfig clusterMaxIterations(int v) { this.clusterMaxIterations = v; return this; }
    public OutbreakConfig forecastHorizon(int v) { this.forecastHorizon = v; return this; }
    public OutbreakConfig seasonalPeriod(int v) { this.seasonalPeriod = v; return this; }
    public OutbreakConfig order(int p, int d, int q) { this.order = new int[] {p, d, q}; return this; }
    public OutbreakConfig seasonalOrder(int p, int d, int q) { this.seasonalOrder = new int[] {p, d, q}; return this; }
    public OutbreakConfig alertZ(double v) { this.alertZ = v; return this; }
    public OutbreakConfig minHistory(Integer v) { this.minHistory = v; return this; }
    public OutbreakConfig shortHistoryPolicy(ShortHistoryPolicy v) { this.shortHistoryPolicy = v; return this; }
    public OutbreakConfig forecastStrategy(ForecastStrategy v) { this.forecastStrategy = v; return this; }
    public OutbreakConfig movingAverageWindow(int v) { this.movingAverageWindow = v; return this; }
    public OutbreakConfig confidenceLevel(double v) { this.confidenceLevel = v; return this; }
    public OutbreakConfig optimizerMaxEvaluations(int v) { this.optimizerMaxEvaluations = v; return this; }
    public OutbreakConfig workerThreads(int v) { this.workerThreads = v; return this; }
    public OutbreakConfig diseases(List<String> v) { this.diseases = v == null ? null : new ArrayList<>(v); return this; }
}
