package luxgrowth.ml;

import org.apache.commons.math3.distribution.NormalDistribution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * Projects a fitted ARIMAX model forward.
 * <p>
 * Future innovations are zero, the ARMA error is extrapolated from its last values, the
 * regression mean uses the supplied future regressor rows, and the result is integrated d
 * times back to the original scale. The interval is ± z·se with se² = σ²Σψⱼ² over the ψ-weights
 * of φ(B)(1−B)^d and θ(B).
 */
public class Forecaster {

    private static final Logger LOG = LoggerFactory.getLogger(Forecaster.class);
    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private final int defaultHorizon;
    private final double defaultConfidence;

    public Forecaster() {
        this(1, 0.95);
    }

    public Forecaster(int defaultHorizon, double defaultConfidence) {
        checkHorizon(defaultHorizon);
        checkConfidence(defaultConfidence);
        this.defaultHorizon = defaultHorizon;
        this.defaultConfidence = defaultConfidence;
    }

    public static Forecaster from(ForecastSettings settings) {
        return new Forecaster(settings.getHorizon(), settings.getConfidence());
    }

    public ForecastResult forecast(FittedModel model, RegressorRow futureRow) {
        return forecast(model, futureRow, defaultHorizon, defaultConfidence);
    }

    /** Forecast scored against the observed value. */
    public ForecastResult forecast(FittedModel model, RegressorRow futureRow, double actual) {
        return forecast(model, futureRow).withActual(actual);
    }

    /**
     * @param horizon steps ahead; the same regressor row is used for every step
     * @throws ModelingException {@link ErrorKind#REGRESSOR_SHAPE_MISMATCH} if the row's covariates differ
     *                           from the model's in name or order
     */
    public ForecastResult forecast(FittedModel model, RegressorRow futureRow, int horizon, double confidence) {
        checkHorizon(horizon);
        return forecast(model, Collections.nCopies(horizon, futureRow), confidence);
    }

    /** One regressor row per step; the horizon is the number of rows. */
    public ForecastResult forecast(FittedModel model, List<RegressorRow> futureRows, double confidence) {
        checkHorizon(futureRows.size());
        checkConfidence(confidence);
        for (RegressorRow row : futureRows) {
            if (!row.labels().equals(model.getRegressorLabels())) {
                throw new ModelingException(ErrorKind.REGRESSOR_SHAPE_MISMATCH,
                    "Future regressors " + row.labels() + " do not match model regressors " + model.getRegressorLabels());
            }
        }

        ModelOrder order = model.getOrder();
        int h = futureRows.size();
        double[] phi = model.getArCoefficients();
        double[] theta = model.getMaCoefficients();
        double[] w = model.regressionErrors();
        double[] e = model.getResiduals();
        int m = w.length;

        double[] wExt = new double[m + h];
        double[] eExt = new double[m + h];
        System.arraycopy(w, 0, wExt, 0, m);
        System.arraycopy(e, 0, eExt, 0, m);
        double[] differencedPath = new double[h];
        for (int s = 0; s < h; s++) {
            int t = m + s;
            double next = 0;
            for (int i = 0; i < phi.length && t - 1 - i >= 0; i++) next += phi[i] * wExt[t - 1 - i];
            for (int j = 0; j < theta.length && t - 1 - j >= 0; j++) next += theta[j] * eExt[t - 1 - j];
            wExt[t] = next;
            differencedPath[s] = model.regressionMean(futureRows.get(s).values()) + next;
        }

        double[] path = integrate(model.getSeries().values(), order.getD(), differencedPath);

        double[] psi = ArmaPolynomials.psiWeights(phi, order.getD(), theta, h);
        double sumSq = 0;
        for (double v : psi) sumSq += v * v;
        double se = Math.sqrt(model.getSigma2() * sumSq);
        double critical = STANDARD_NORMAL.inverseCumulativeProbability(0.5 + confidence / 2.0);

        int targetYear = model.getSeries().lastYear() + h;
        ForecastResult result = new ForecastResult(order, targetYear, path, se, confidence, critical, null);
        LOG.debug("{}", result);
        return result;
    }

    /**
     * Undo d-fold differencing: each forecast of ∇ᵈy is added back level by level onto the last
     * observed (or already forecast) values.
     */
    static double[] integrate(double[] levels, int d, double[] differencedPath) {
        int h = differencedPath.length;
        double[] last = new double[d];
        for (int k = 0; k < d; k++) {
            double[] diffed = SeriesStore.difference(levels, k);
            last[k] = diffed[diffed.length - 1];
        }
        double[] path = new double[h];
        for (int s = 0; s < h; s++) {
            double value = differencedPath[s];
            for (int k = d - 1; k >= 0; k--) {
                value += last[k];
                last[k] = value;
            }
            path[s] = value;
        }
        return path;
    }

    private static void checkHorizon(int horizon) {
        if (horizon < 1) throw new IllegalArgumentException("horizon must be positive: " + horizon);
    }

    private static void checkConfidence(double confidence) {
        if (!(confidence > 0 && confidence < 1)) throw new IllegalArgumentException("confidence must be in (0,1): " + confidence);
    }
}
