package luxgrowth.ml;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Ordinary least squares with an intercept.
 * <p>
 * Model: y = β₀ + β₁x₁ + … + βₖxₖ, solved through the normal equation β = (X'X)⁻¹X'y.
 * Used for the auxiliary regressions of the residual diagnostics and for starting values
 * of autoregressive coefficients.
 */
public class LinearRegression {

    private final double[] coefficients;  // β₀, β₁, ..., βₖ
    private final double[] residuals;
    private final double rSquared;
    private final double adjustedRSquared;
    private final int n;
    private final int p;

    /**
     * @param X design matrix (rows = observations, columns = covariates; no intercept column)
     * @param y response vector
     * @throws IllegalArgumentException if shapes disagree or there are no more observations than parameters
     * @throws SingularMatrixException  if X'X cannot be inverted (e.g. a constant covariate)
     */
    public LinearRegression(double[][] X, double[] y) {
        if (X == null || y == null || X.length != y.length || X.length == 0) {
            throw new IllegalArgumentException("X and y must be non-null, same length, and non-empty");
        }
        n = X.length;
        int features = X[0].length;
        p = features + 1;
        if (n <= p) {
            throw new IllegalArgumentException(n + " observations cannot identify " + p + " coefficients");
        }

        double[][] design = new double[n][p];
        for (int i = 0; i < n; i++) {
            if (X[i].length != features) throw new IllegalArgumentException("Ragged design matrix at row " + i);
            design[i][0] = 1.0;
            System.arraycopy(X[i], 0, design[i], 1, features);
        }

        RealMatrix Xm = MatrixUtils.createRealMatrix(design);
        RealVector yv = MatrixUtils.createRealVector(y);
        RealMatrix Xt = Xm.transpose();
        DecompositionSolver solver = new LUDecomposition(Xt.multiply(Xm)).getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularMatrixException();
        }
        coefficients = solver.solve(Xt.operate(yv)).toArray();

        residuals = new double[n];
        double meanY = 0;
        for (double v : y) meanY += v;
        meanY /= n;
        double ssTot = 0, ssRes = 0;
        for (int i = 0; i < n; i++) {
            residuals[i] = y[i] - predict(X[i]);
            ssTot += (y[i] - meanY) * (y[i] - meanY);
            ssRes += residuals[i] * residuals[i];
        }
        rSquared = (ssTot > 0) ? 1.0 - (ssRes / ssTot) : 0;
        adjustedRSquared = 1.0 - (1.0 - rSquared) * (n - 1) / (n - p);
    }

    public double getIntercept() {
        return coefficients[0];
    }

    /** Coefficient for covariate i (0-based, excluding the intercept). */
    public double getCoefficient(int i) {
        return coefficients[i + 1];
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double[] getResiduals() {
        return residuals.clone();
    }

    public double getRSquared() { return rSquared; }
    public double getAdjustedRSquared() { return adjustedRSquared; }
    public int getObservationCount() { return n; }

    public double predict(double[] x) {
        double y = coefficients[0];
        for (int i = 0; i < x.length; i++) {
            y += coefficients[i + 1] * x[i];
        }
        return y;
    }
}
