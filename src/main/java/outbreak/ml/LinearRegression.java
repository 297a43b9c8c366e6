package outbreak.ml;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Ordinary least squares with an intercept.
 * <p>
 * Model: y = β₀ + β₁x₁ + ... + βₙxₙ + ε, solved by the normal equation β = (X'X)⁻¹X'y.
 * Besides the coefficients it keeps (X'X)⁻¹ and the residual variance so that the
 * standard error of a new prediction can be reported.
 */
public class LinearRegression {

    private final double[] coefficients;  // β₀, β₁, ..., βₙ
    private final RealMatrix covarianceUnscaled; // (X'X)⁻¹
    private final double residualVariance;
    private final double rSquared;
    private final int n;
    private final int p;

    /**
     * @param X design matrix (rows = observations, columns = features; no intercept column)
     * @param y response vector (length = number of observations)
     */
    public LinearRegression(double[][] X, double[] y) {
        if (X == null || y == null || X.length != y.length || X.length == 0) {
            throw new IllegalArgumentException("X and y must be non-null, same length, and non-empty");
        }
        n = X.length;
        int features = X[0].length;
        p = features + 1;

        double[][] design = new double[n][p];
        for (int i = 0; i < n; i++) {
            design[i][0] = 1.0;
            for (int j = 0; j < features; j++) {
                design[i][j + 1] = X[i][j];
            }
        }

        RealMatrix Xm = MatrixUtils.createRealMatrix(design);
        RealVector yv = MatrixUtils.createRealVector(y);
        RealMatrix Xt = Xm.transpose();
        DecompositionSolver solver = new LUDecomposition(Xt.multiply(Xm)).getSolver();
        if (!solver.isNonSingular()) {
            throw new IllegalArgumentException("Design matrix X'X is singular; cannot compute (X'X)⁻¹");
        }
        coefficients = solver.solve(Xt.operate(yv)).toArray();
        covarianceUnscaled = solver.getInverse();

        double[] fitted = predict(X);
        double meanY = 0;
        for (double v : y) meanY += v;
        meanY /= n;
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < n; i++) {
            ssTot += (y[i] - meanY) * (y[i] - meanY);
            ssRes += (y[i] - fitted[i]) * (y[i] - fitted[i]);
        }
        rSquared = (ssTot > 0) ? 1.0 - (ssRes / ssTot) : 0;
        residualVariance = (n > p) ? ssRes / (n - p) : Double.NaN;
    }

    public double getIntercept() {
        return coefficients[0];
    }

    /** Coefficient for feature i (0-based); β₁ is feature 0. */
    public double getCoefficient(int i) {
        return coefficients[i + 1];
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getRSquared() { return rSquared; }

    /** s² = SS_res / (n - p); NaN when there are no residual degrees of freedom. */
    public double getResidualVariance() { return residualVariance; }

    public double predict(double[] x) {
        double y = coefficients[0];
        for (int i = 0; i < x.length; i++) {
            y += coefficients[i + 1] * x[i];
        }
        return y;
    }

    public double[] predict(double[][] X) {
        double[] out = new double[X.length];
        for (int i = 0; i < X.length; i++) {
            out[i] = predict(X[i]);
        }
        return out;
    }

    /**
     * Standard error of a new observation at x: sqrt(s²(1 + x₀'(X'X)⁻¹x₀)), x₀ = (1, x).
     */
    public double predictionStandardError(double[] x) {
        double[] x0 = new double[p];
        x0[0] = 1.0;
        System.arraycopy(x, 0, x0, 1, x.length);
        RealVector v = MatrixUtils.createRealVector(x0);
        double leverage = v.dotProduct(covarianceUnscaled.operate(v));
        return Math.sqrt(residualVariance * (1.0 + leverage));
    }
}
