package outbreak.ml;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.MultivariateOptimizer;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import outbreak.InsufficientHistoryException;
import outbreak.ModelFitException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Seasonal Autoregressive Integrated Moving Average (SARIMA) model.
 * <p>
 * Model: SARIMA(p,d,q)(P,D,Q)s
 * φ(B)Φ(B^s) ∇^d ∇_s^D y_t = θ(B)Θ(B^s) ε_t
 * <p>
 * - p,d,q: non-seasonal AR order, differencing, MA order
 * - P,D,Q: seasonal AR, seasonal differencing, seasonal MA
 * - s: season length (52 for weekly data with yearly seasonality)
 * <p>
 * Regular differences drop their first d observations. Seasonal differences keep the full
 * length: the first season is differenced against a backcast season equal to its own mean,
 * so the observations that seasonal differencing would otherwise consume still feed the
 * seasonal lags. Coefficients are estimated by Gaussian maximum likelihood conditional on
 * that first s·D + p stretch of the differenced series, with earlier values and innovations
 * set to zero. With σ² concentrated out the likelihood is maximized exactly where the
 * conditional sum of squares is minimized, which is what the optimizer works on.
 * Coefficients are bounded to (-1, 1) so that every factor stays stationary and invertible.
 * Forecast variances come from the ψ-weights of the integrated model.
 */
public class Sarima {

    private static final Logger log = LoggerFactory.getLogger(Sarima.class);

    static final double BOUND = 0.99;
    private static final double START_LIMIT = 0.9;

    private final int p, d, q, P, D, Q, s;
    private final double[] ar;         // φ₁..φₚ
    private final double[] ma;         // θ₁..θq
    private final double[] seasonalAr; // Φ₁..Φ_P
    private final double[] seasonalMa; // Θ₁..Θ_Q
    /** levels[0] is the input, each following level one differencing step further. */
    private final List<double[]> levels = new ArrayList<>();
    private final int[] lags;
    /** Observations each differencing step drops: the lag for regular steps, 0 for seasonal ones. */
    private final int[] dropped;
    private final double[] residuals;
    private final int conditioning;
    private final double sigma2;
    private final double logLikelihood;
    private final int evaluations;

    public Sarima(int p, int d, int q, int P, int D, int Q, int s, double[] data, int maxEvaluations) {
        if (p < 0 || d < 0 || q < 0 || P < 0 || D < 0 || Q < 0) {
            throw new IllegalArgumentException("orders must be >= 0");
        }
        if (s < 1 && (P > 0 || D > 0 || Q > 0)) {
            throw new IllegalArgumentException("season length must be >= 1 for a seasonal model");
        }
        this.p = p;
        this.d = d;
        this.q = q;
        this.P = P;
        this.D = D;
        this.Q = Q;
        this.s = s;

        int nParams = p + q + P + Q;
        int required = minimumObservations(p, d, q, P, D, Q, s);
        if (data.length < required) {
            throw new InsufficientHistoryException(data.length + " observations, SARIMA(" + p + "," + d + ","
                + q + ")(" + P + "," + D + "," + Q + ")" + s + " needs " + required + " to fit "
                + nParams + " coefficients");
        }

        this.lags = new int[d + D];
        this.dropped = new int[d + D];
        for (int i = 0; i < d; i++) {
            lags[i] = 1;
            dropped[i] = 1;
        }
        for (int i = 0; i < D; i++) lags[d + i] = s;
        levels.add(data.clone());
        for (int i = 0; i < lags.length; i++) {
            double[] base = levels.get(levels.size() - 1);
            levels.add(i < d ? diff(base, 1) : seasonalDiff(base, s));
        }
        double[] w = differenced();
        this.conditioning = s * D + p;

        Fit fit = estimateParameters(w, nParams, maxEvaluations);
        double[] params = fit.params;
        int idx = 0;
        this.ar = Arrays.copyOfRange(params, idx, idx += p);
        this.ma = Arrays.copyOfRange(params, idx, idx += q);
        this.seasonalAr = Arrays.copyOfRange(params, idx, idx += P);
        this.seasonalMa = Arrays.copyOfRange(params, idx, idx + Q);
        this.evaluations = fit.evaluations;

        this.residuals = innovations(w, params);
        int effective = w.length - conditioning;
        double rss = 0;
        for (int t = conditioning; t < w.length; t++) rss += residuals[t] * residuals[t];
        this.sigma2 = rss / effective;
        this.logLikelihood = -0.5 * effective * (Math.log(2 * Math.PI * sigma2) + 1);
        log.debug("SARIMA({},{},{})({},{},{}){} fit: φ={} θ={} Φ={} Θ={} σ²={} after {} evaluations",
            p, d, q, P, D, Q, s, Arrays.toString(ar), Arrays.toString(ma),
            Arrays.toString(seasonalAr), Arrays.toString(seasonalMa), sigma2, evaluations);
    }

    /**
     * Fewest observations that leave {@code p + q + P + Q + 2} residuals after the regular
     * differences and the conditioning stretch of s·D + p values.
     */
    public static int minimumObservations(int p, int d, int q, int P, int D, int Q, int s) {
        return d + s * D + p + (p + q + P + Q) + 2;
    }

    private static double[] diff(double[] x, int lag) {
        if (lag >= x.length) return new double[0];
        double[] out = new double[x.length - lag];
        for (int i = lag; i < x.length; i++) {
            out[i - lag] = x[i] - x[i - lag];
        }
        return out;
    }

    /** x[t] - x[t-s], with x[t-s] for t < s replaced by the mean of the first season. */
    private static double[] seasonalDiff(double[] x, int s) {
        double backcast = new Mean().evaluate(x, 0, s);
        double[] out = new double[x.length];
        for (int t = 0; t < x.length; t++) {
            out[t] = x[t] - (t >= s ? x[t - s] : backcast);
        }
        return out;
    }

    private double[] differenced() {
        return levels.get(levels.size() - 1);
    }

    private Fit estimateParameters(double[] w, int nParams, int maxEvaluations) {
        double[] start = initialGuess(w, nParams);
        if (nParams == 0 || isAllZero(w)) {
            return new Fit(start, 0);
        }
        try {
            if (nParams == 1) {
                BrentOptimizer brent = new BrentOptimizer(1e-10, 1e-12);
                UnivariatePointValuePair result = brent.optimize(
                    new MaxEval(maxEvaluations),
                    new UnivariateObjectiveFunction(x -> sumOfSquares(w, new double[] {x})),
                    GoalType.MINIMIZE,
                    new SearchInterval(-BOUND, BOUND, start[0]));
                checkFinite(result.getValue());
                return new Fit(new double[] {result.getPoint()}, brent.getEvaluations());
            }
            MultivariateOptimizer opt = new BOBYQAOptimizer(2 * nParams + 1, 0.3, 1e-7);
            double[] lower = new double[nParams];
            double[] upper = new double[nParams];
            Arrays.fill(lower, -BOUND);
            Arrays.fill(upper, BOUND);
            PointValuePair result = opt.optimize(
                new MaxEval(maxEvaluations),
                new ObjectiveFunction(params -> sumOfSquares(w, params)),
                GoalType.MINIMIZE,
                new InitialGuess(start),
                new SimpleBounds(lower, upper));
            checkFinite(result.getValue());
            return new Fit(result.getPoint(), opt.getEvaluations());
        } catch (TooManyEvaluationsException e) {
            throw new ModelFitException("likelihood optimizer did not converge within "
                + maxEvaluations + " evaluations", e);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new ModelFitException("likelihood optimization failed: " + e.getMessage(), e);
        }
    }

    private static void checkFinite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ModelFitException("likelihood optimizer ended at a non-finite objective");
        }
    }

    /** AR terms from an OLS regression on lags, everything else 0.1. */
    private double[] initialGuess(double[] z, int nParams) {
        double[] params = new double[nParams];
        Arrays.fill(params, 0.1);
        if (p > 0 && z.length > 2 * p + 1) {
            double[][] X = new double[z.length - p][p];
            double[] y = new double[z.length - p];
            for (int i = p; i < z.length; i++) {
                for (int j = 0; j < p; j++) X[i - p][j] = z[i - 1 - j];
                y[i - p] = z[i];
            }
            try {
                LinearRegression lr = new LinearRegression(X, y);
                for (int i = 0; i < p; i++) {
                    params[i] = Math.max(-START_LIMIT, Math.min(START_LIMIT, lr.getCoefficient(i)));
                }
            } catch (IllegalArgumentException e) {
                log.debug("Lag regression singular, AR starts at 0.1: {}", e.getMessage());
            }
        }
        return params;
    }

    private static boolean isAllZero(double[] x) {
        for (double v : x) {
            if (v != 0) return false;
        }
        return true;
    }

    /** Conditional sum of squares over t ≥ s·D + p. */
    private double sumOfSquares(double[] w, double[] params) {
        double[] e = innovations(w, params);
        double rss = 0;
        for (int t = conditioning; t < w.length; t++) rss += e[t] * e[t];
        return Double.isNaN(rss) || Double.isInfinite(rss) ? Double.MAX_VALUE : rss;
    }

    private double[] innovations(double[] w, double[] params) {
        double[] a = autoregressiveLags(params);
        double[] b = movingAverageLags(params);
        double[] e = new double[w.length];
        for (int t = 0; t < w.length; t++) {
            double pred = 0;
            for (int k = 1; k < a.length && t - k >= 0; k++) pred -= a[k] * w[t - k];
            for (int k = 1; k < b.length && t - k >= 0; k++) pred += b[k] * e[t - k];
            e[t] = w[t] - pred;
        }
        return e;
    }

    /** Coefficients of φ(B)Φ(B^s), index = power of B, leading 1. */
    private double[] autoregressiveLags(double[] params) {
        double[] nonSeasonal = new double[p + 1];
        nonSeasonal[0] = 1;
        for (int i = 0; i < p; i++) nonSeasonal[i + 1] = -params[i];
        double[] seasonal = new double[s * P + 1];
        seasonal[0] = 1;
        for (int i = 0; i < P; i++) seasonal[s * (i + 1)] = -params[p + q + i];
        return multiply(nonSeasonal, seasonal);
    }

    /** Coefficients of θ(B)Θ(B^s), index = power of B, leading 1. */
    private double[] movingAverageLags(double[] params) {
        double[] nonSeasonal = new double[q + 1];
        nonSeasonal[0] = 1;
        for (int i = 0; i < q; i++) nonSeasonal[i + 1] = params[p + i];
        double[] seasonal = new double[s * Q + 1];
        seasonal[0] = 1;
        for (int i = 0; i < Q; i++) seasonal[s * (i + 1)] = params[p + q + P + i];
        return multiply(nonSeasonal, seasonal);
    }

    static double[] multiply(double[] a, double[] b) {
        double[] out = new double[a.length + b.length - 1];
        for (int i = 0; i < a.length; i++) {
            if (a[i] == 0) continue;
            for (int j = 0; j < b.length; j++) out[i + j] += a[i] * b[j];
        }
        return out;
    }

    private double[] params() {
        double[] out = new double[p + q + P + Q];
        int idx = 0;
        for (double v : ar) out[idx++] = v;
        for (double v : ma) out[idx++] = v;
        for (double v : seasonalAr) out[idx++] = v;
        for (double v : seasonalMa) out[idx++] = v;
        return out;
    }

    /** Forecast the next {@code steps} values in the original scale. */
    public double[] forecast(int steps) {
        if (steps < 1) throw new IllegalArgumentException("steps must be >= 1");
        double[] params = params();
        double[] a = autoregressiveLags(params);
        double[] b = movingAverageLags(params);

        double[] w = differenced();
        int m = w.length;
        double[] next = Arrays.copyOf(w, m + steps);
        double[] e = Arrays.copyOf(residuals, m + steps);
        for (int t = m; t < m + steps; t++) {
            double pred = 0;
            for (int k = 1; k < a.length && t - k >= 0; k++) pred -= a[k] * next[t - k];
            for (int k = 1; k < b.length && t - k >= 0; k++) pred += b[k] * e[t - k];
            next[t] = pred;
        }

        // undo differencing one level at a time: x[n+h] = ∇x[n+h] + x[n+h-lag]
        for (int level = levels.size() - 2; level >= 0; level--) {
            double[] base = levels.get(level);
            int n = base.length;
            int lag = lags[level];
            int shift = dropped[level];
            double[] ext = Arrays.copyOf(base, n + steps);
            for (int h = 0; h < steps; h++) {
                ext[n + h] = next[n + h - shift] + ext[n + h - lag];
            }
            next = ext;
        }
        int n = levels.get(0).length;
        return Arrays.copyOfRange(next, n, n + steps);
    }

    /** ψ-weights ψ₀..ψ_{count-1} of the integrated model, ψ₀ = 1. */
    public double[] psiWeights(int count) {
        double[] params = params();
        double[] full = autoregressiveLags(params);
        for (int lag : lags) {
            double[] op = new double[lag + 1];
            op[0] = 1;
            op[lag] = -1;
            full = multiply(full, op);
        }
        double[] b = movingAverageLags(params);
        double[] psi = new double[count];
        for (int j = 0; j < count; j++) {
            double v = j == 0 ? 1 : (j < b.length ? b[j] : 0);
            for (int k = 1; k <= j && k < full.length; k++) v -= full[k] * psi[j - k];
            psi[j] = v;
        }
        return psi;
    }

    /** Standard error of the h-step forecast, h = 1..steps: sqrt(σ² Σ_{j<h} ψ_j²). */
    public double[] forecastStandardErrors(int steps) {
        double[] psi = psiWeights(steps);
        double[] out = new double[steps];
        double acc = 0;
        for (int h = 0; h < steps; h++) {
            acc += psi[h] * psi[h];
            out[h] = Math.sqrt(sigma2 * acc);
        }
        return out;
    }

    public double[] getAr() { return ar.clone(); }
    public double[] getMa() { return ma.clone(); }
    public double[] getSeasonalAr() { return seasonalAr.clone(); }
    public double[] getSeasonalMa() { return seasonalMa.clone(); }
    public double getSigma2() { return sigma2; }
    public double getLogLikelihood() { return logLikelihood; }

    public int getP() { return p; }
    public int getD() { return d; }
    public int getQ() { return q; }
    public int getSeasonalP() { return P; }
    public int getSeasonalD() { return D; }
    public int getSeasonalQ() { return Q; }

    @Override
    public String toString() {
        return "SARIMA(" + p + "," + d + "," + q + ")(" + P + "," + D + "," + Q + ")" + s;
    }

    private static final class Fit {
        final double[] params;
        final int evaluations;

        Fit(double[] params, int evaluations) {
            this.params = params;
            this.evaluations = evaluations;
        }
    }
}
