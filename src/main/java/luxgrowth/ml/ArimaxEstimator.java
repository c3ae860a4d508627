package luxgrowth.ml;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleBounds;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.BOBYQAOptimizer;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Conditional-sum-of-squares estimator for ARIMA(p,d,q) errors with exogenous regressors.
 * <p>
 * Only the series is differenced; regressor rows of the matching years enter the mean
 * undifferenced. Pre-sample values of the error and innovation sequences are zero. For a
 * given set of ARMA coefficients the residuals are linear in (c, β), so those are solved by
 * least squares and only the p + q ARMA coefficients are searched numerically: BOBYQA when
 * there are two or more, Brent when there is one.
 */
public class ArimaxEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(ArimaxEstimator.class);

    /** Box for the unconstrained ARMA coordinates; |u| = 8 is a partial autocorrelation of 0.992. */
    private static final double UNCONSTRAINED_BOUND = 8.0;
    private static final double RANK_THRESHOLD = 1e-10;

    /** When the regression mean gets a constant term. */
    public enum InterceptPolicy {
        /** Only for undifferenced fits (d = 0). */
        AUTO,
        ALWAYS,
        NEVER;

        boolean includes(ModelOrder order) {
            return this == ALWAYS || (this == AUTO && order.getD() == 0);
        }
    }

    private final InterceptPolicy interceptPolicy;
    private final int maxEvaluations;

    public ArimaxEstimator() {
        this(InterceptPolicy.AUTO, 5000);
    }

    public ArimaxEstimator(InterceptPolicy interceptPolicy, int maxEvaluations) {
        if (maxEvaluations < 10) throw new IllegalArgumentException("maxEvaluations too small: " + maxEvaluations);
        this.interceptPolicy = interceptPolicy;
        this.maxEvaluations = maxEvaluations;
    }

    public static ArimaxEstimator from(ForecastSettings settings) {
        return new ArimaxEstimator(settings.getInterceptPolicy(), settings.getMaxEvaluations());
    }

    /**
     * Fit one order against one regressor set.
     *
     * @throws ModelingException {@link ErrorKind#DIMENSION_MISMATCH} if the regressors lack rows for
     *                           the series years, {@link ErrorKind#ESTIMATION_FAILURE} for any numerical failure
     */
    public FittedModel fit(SeriesStore series, ModelOrder order, RegressorSet regressors) {
        int p = order.getP(), d = order.getD(), q = order.getQ();
        boolean intercept = interceptPolicy.includes(order);
        int m = series.size() - d;
        int parameters = p + q + regressors.width() + (intercept ? 1 : 0);
        if (m <= parameters + 1) {
            throw new ModelingException(ErrorKind.ESTIMATION_FAILURE, "Order " + order + " with "
                + parameters + " parameters needs more than " + (parameters + 1) + " observations after differencing, got " + m);
        }

        double[] z = series.difference(d);
        int[] years = Arrays.copyOfRange(series.years(), d, series.size());
        double[][] design = regressors.alignTo(years);
        double[][] meanColumns = meanDesign(design, intercept);
        if (meanColumns.length > 0 && meanColumns[0].length > 0) {
            RealMatrix R = MatrixUtils.createRealMatrix(meanColumns);
            if (!new QRDecomposition(R, RANK_THRESHOLD).getSolver().isNonSingular()) {
                throw new ModelingException(ErrorKind.ESTIMATION_FAILURE,
                    "Singular regression design for set '" + regressors.name() + "' (constant or collinear covariates)");
            }
        }

        try {
            ConditionalSumOfSquares css = new ConditionalSumOfSquares(z, meanColumns, p, q);
            double[] u = optimize(css, initialGuess(z, meanColumns, p, q));
            double[] phi = ArmaPolynomials.toStationaryAr(Arrays.copyOfRange(u, 0, p));
            double[] theta = ArmaPolynomials.toInvertibleMa(Arrays.copyOfRange(u, p, p + q));
            if (!ArmaPolynomials.isStationary(phi)) {
                throw new ModelingException(ErrorKind.ESTIMATION_FAILURE,
                    "AR polynomial has a unit root: " + Arrays.toString(phi));
            }
            if (!ArmaPolynomials.isInvertible(theta)) {
                throw new ModelingException(ErrorKind.ESTIMATION_FAILURE,
                    "MA polynomial is not invertible: " + Arrays.toString(theta));
            }
            double[] mean = css.meanCoefficients(phi, theta);
            double c = intercept ? mean[0] : 0.0;
            double[] beta = Arrays.copyOfRange(mean, intercept ? 1 : 0, mean.length);

            FittedModel model = new FittedModel(order, series, regressors, design, intercept, c, phi, theta, beta);
            if (!(model.getSigma2() > 0) || !Double.isFinite(model.getLogLikelihood())) {
                throw new ModelingException(ErrorKind.ESTIMATION_FAILURE,
                    "Degenerate fit with residual variance " + model.getSigma2());
            }
            LOG.debug("Fitted {}", model);
            return model;
        } catch (SingularMatrixException e) {
            throw new ModelingException(ErrorKind.ESTIMATION_FAILURE, "Singular filtered design for " + order, e);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw new ModelingException(ErrorKind.ESTIMATION_FAILURE,
                "Optimizer failed for " + order + ": " + e.getMessage(), e);
        }
    }

    private double[] optimize(ConditionalSumOfSquares css, double[] start) {
        int dims = start.length;
        if (dims == 0) {
            return start;
        }
        if (dims == 1) {
            BrentOptimizer brent = new BrentOptimizer(1e-10, 1e-14);
            UnivariatePointValuePair result = brent.optimize(
                new MaxEval(maxEvaluations),
                new UnivariateObjectiveFunction(x -> css.value(new double[] {x})),
                GoalType.MINIMIZE,
                new SearchInterval(-UNCONSTRAINED_BOUND, UNCONSTRAINED_BOUND, start[0]));
            return new double[] {result.getPoint()};
        }
        double[] lower = new double[dims];
        double[] upper = new double[dims];
        Arrays.fill(lower, -UNCONSTRAINED_BOUND);
        Arrays.fill(upper, UNCONSTRAINED_BOUND);
        BOBYQAOptimizer opt = new BOBYQAOptimizer(2 * dims + 1, 0.5, 1e-7);
        PointValuePair result = opt.optimize(
            new MaxEval(maxEvaluations),
            new ObjectiveFunction(css::value),
            GoalType.MINIMIZE,
            new InitialGuess(start),
            new SimpleBounds(lower, upper));
        return result.getPoint();
    }

    /**
     * Starting point: AR coefficients from an OLS regression of the OLS regression errors on
     * their own lags, MA coefficients at zero.
     */
    private static double[] initialGuess(double[] z, double[][] meanColumns, int p, int q) {
        double[] start = new double[p + q];
        if (p == 0 || z.length <= 2 * p + 2) return start;
        double[] w = z.clone();
        if (meanColumns[0].length > 0) {
            double[] mean = leastSquares(meanColumns, z);
            for (int t = 0; t < w.length; t++) {
                for (int j = 0; j < mean.length; j++) w[t] -= mean[j] * meanColumns[t][j];
            }
        }
        double[][] lags = new double[w.length - p][p];
        double[] y = new double[w.length - p];
        for (int t = p; t < w.length; t++) {
            for (int i = 0; i < p; i++) lags[t - p][i] = w[t - 1 - i];
            y[t - p] = w[t];
        }
        try {
            LinearRegression lr = new LinearRegression(lags, y);
            double[] phi = new double[p];
            for (int i = 0; i < p; i++) phi[i] = lr.getCoefficient(i);
            double[] u = ArmaPolynomials.fromStationaryAr(phi);
            if (u != null) {
                for (int i = 0; i < p; i++) {
                    start[i] = Math.max(-UNCONSTRAINED_BOUND + 0.5, Math.min(UNCONSTRAINED_BOUND - 0.5, u[i]));
                }
            }
        } catch (IllegalArgumentException e) {
            // SingularMatrixException is one of these too
            LOG.debug("No OLS starting values for AR({}), starting at zero: {}", p, e.getMessage());
        }
        return start;
    }

    /** Intercept column (optional) followed by the regressor columns. */
    private static double[][] meanDesign(double[][] design, boolean intercept) {
        double[][] out = new double[design.length][];
        for (int t = 0; t < design.length; t++) {
            double[] row = new double[design[t].length + (intercept ? 1 : 0)];
            if (intercept) row[0] = 1.0;
            System.arraycopy(design[t], 0, row, intercept ? 1 : 0, design[t].length);
            out[t] = row;
        }
        return out;
    }

    static double[] leastSquares(double[][] X, double[] y) {
        DecompositionSolver solver = new QRDecomposition(MatrixUtils.createRealMatrix(X), RANK_THRESHOLD).getSolver();
        return solver.solve(MatrixUtils.createRealVector(y)).toArray();
    }

    /**
     * eₜ = wₜ − Σφᵢwₜ₋ᵢ − Σθⱼeₜ₋ⱼ with zero pre-sample values.
     */
    static double[] innovations(double[] w, double[] ar, double[] ma) {
        double[] e = new double[w.length];
        for (int t = 0; t < w.length; t++) {
            double v = w[t];
            for (int i = 0; i < ar.length && t - 1 - i >= 0; i++) v -= ar[i] * w[t - 1 - i];
            for (int j = 0; j < ma.length && t - 1 - j >= 0; j++) v -= ma[j] * e[t - 1 - j];
            e[t] = v;
        }
        return e;
    }

    /** Sum of squared innovations as a function of the unconstrained ARMA coordinates. */
    private static final class ConditionalSumOfSquares {

        private final double[] z;
        private final double[][] meanColumns;
        private final int p, q, width;

        ConditionalSumOfSquares(double[] z, double[][] meanColumns, int p, int q) {
            this.z = z;
            this.meanColumns = meanColumns;
            this.p = p;
            this.q = q;
            this.width = meanColumns.length == 0 ? 0 : meanColumns[0].length;
        }

        double value(double[] u) {
            double[] phi = ArmaPolynomials.toStationaryAr(Arrays.copyOfRange(u, 0, p));
            double[] theta = ArmaPolynomials.toInvertibleMa(Arrays.copyOfRange(u, p, p + q));
            double[] e;
            try {
                e = residuals(phi, theta, meanCoefficients(phi, theta));
            } catch (SingularMatrixException ex) {
                return Double.MAX_VALUE;
            }
            double ss = 0;
            for (double v : e) ss += v * v;
            return Double.isFinite(ss) ? ss : Double.MAX_VALUE;
        }

        /**
         * The innovation filter is linear, so filtering z and each mean column and regressing one
         * on the other gives the (c, β) that minimise the sum of squares for these coefficients.
         */
        double[] meanCoefficients(double[] phi, double[] theta) {
            if (width == 0) return new double[0];
            double[] fz = innovations(z, phi, theta);
            double[][] fx = new double[z.length][width];
            double[] column = new double[z.length];
            for (int j = 0; j < width; j++) {
                for (int t = 0; t < z.length; t++) column[t] = meanColumns[t][j];
                double[] filtered = innovations(column, phi, theta);
                for (int t = 0; t < z.length; t++) fx[t][j] = filtered[t];
            }
            return leastSquares(fx, fz);
        }

        private double[] residuals(double[] phi, double[] theta, double[] mean) {
            double[] w = z.clone();
            for (int t = 0; t < w.length; t++) {
                for (int j = 0; j < width; j++) w[t] -= mean[j] * meanColumns[t][j];
            }
            return innovations(w, phi, theta);
        }
    }
}
