package luxgrowth.ml;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ARIMAX fit of one (order, regressor set) combination.
 * <p>
 * On the d-times differenced scale the model reads
 * zₜ = c + βᵀxₜ + wₜ with φ(B)wₜ = θ(B)eₜ, where xₜ are the undifferenced regressor values
 * of year t. Residuals eₜ cover the differenced observations, so there are n − d of them.
 * Instances are immutable and only created for successful estimations.
 */
public final class FittedModel {

    private final ModelOrder order;
    private final SeriesStore series;
    private final RegressorSet regressors;
    private final double[][] design;
    private final boolean hasIntercept;
    private final double intercept;
    private final double[] ar;
    private final double[] ma;
    private final double[] beta;
    private final double[] differenced;
    private final double[] residuals;
    private final int[] residualYears;
    private final double sigma2;
    private final double logLikelihood;
    private final int parameterCount;

    /**
     * @param design regressor rows for the years of the differenced observations
     */
    FittedModel(ModelOrder order, SeriesStore series, RegressorSet regressors, double[][] design,
                boolean hasIntercept, double intercept, double[] ar, double[] ma, double[] beta) {
        if (ar.length != order.getP() || ma.length != order.getQ() || beta.length != regressors.width()) {
            throw new IllegalArgumentException("Coefficient counts do not match order " + order
                + " and " + regressors.width() + " regressors");
        }
        this.order = order;
        this.series = series;
        this.regressors = regressors;
        this.differenced = series.difference(order.getD());
        if (design.length != differenced.length) {
            throw new ModelingException(ErrorKind.DIMENSION_MISMATCH,
                design.length + " regressor rows for " + differenced.length + " differenced observations");
        }
        this.design = deepCopy(design);
        this.hasIntercept = hasIntercept;
        this.intercept = hasIntercept ? intercept : 0.0;
        this.ar = ar.clone();
        this.ma = ma.clone();
        this.beta = beta.clone();
        this.residuals = ArimaxEstimator.innovations(regressionErrors(), this.ar, this.ma);
        this.residualYears = Arrays.copyOfRange(series.years(), order.getD(), series.size());

        int m = residuals.length;
        double ss = 0;
        for (double e : residuals) ss += e * e;
        this.sigma2 = ss / m;
        this.logLikelihood = -0.5 * m * (Math.log(2 * Math.PI * sigma2) + 1.0);
        this.parameterCount = order.getP() + order.getQ() + beta.length + (hasIntercept ? 1 : 0);
    }

    /** wₜ = zₜ − c − βᵀxₜ over the differenced observations. */
    double[] regressionErrors() {
        double[] w = new double[differenced.length];
        for (int t = 0; t < w.length; t++) w[t] = differenced[t] - regressionMean(design[t]);
        return w;
    }

    /** c + βᵀx for one regressor row. */
    double regressionMean(double[] x) {
        double mean = intercept;
        for (int j = 0; j < beta.length; j++) mean += beta[j] * x[j];
        return mean;
    }

    public ModelOrder getOrder() { return order; }
    public SeriesStore getSeries() { return series; }
    public RegressorSet getRegressors() { return regressors; }
    public List<String> getRegressorLabels() { return regressors.labels(); }
    public boolean hasIntercept() { return hasIntercept; }
    public double getIntercept() { return intercept; }
    public double[] getArCoefficients() { return ar.clone(); }
    public double[] getMaCoefficients() { return ma.clone(); }
    public double[] getRegressionCoefficients() { return beta.clone(); }

    /** Regression coefficients keyed by covariate label, in column order. */
    public Map<String, Double> getLabelledRegressionCoefficients() {
        Map<String, Double> out = new LinkedHashMap<>();
        List<String> labels = regressors.labels();
        for (int j = 0; j < beta.length; j++) out.put(labels.get(j), beta[j]);
        return Collections.unmodifiableMap(out);
    }

    public double[] getResiduals() { return residuals.clone(); }
    public int[] getResidualYears() { return residualYears.clone(); }
    public double[] getDifferencedSeries() { return differenced.clone(); }

    double[][] getDesign() { return deepCopy(design); }

    /** One-step-ahead fitted values on the original scale, for the years of the residuals. */
    public double[] getFittedValues() {
        double[] y = series.values();
        double[] fitted = new double[residuals.length];
        for (int t = 0; t < fitted.length; t++) fitted[t] = y[t + order.getD()] - residuals[t];
        return fitted;
    }

    public double getSigma2() { return sigma2; }
    public double getLogLikelihood() { return logLikelihood; }
    public int getParameterCount() { return parameterCount; }
    public int getObservationCount() { return residuals.length; }

    public double getAic() {
        return -2.0 * logLikelihood + 2.0 * parameterCount;
    }

    public double getBic() {
        return -2.0 * logLikelihood + parameterCount * Math.log(residuals.length);
    }

    private static double[][] deepCopy(double[][] m) {
        double[][] copy = new double[m.length][];
        for (int i = 0; i < m.length; i++) copy[i] = m[i].clone();
        return copy;
    }

    @Override
    public String toString() {
        return String.format("ARIMAX%s[%s] ar=%s ma=%s beta=%s aic=%.3f bic=%.3f", order, regressors.name(),
            Arrays.toString(ar), Arrays.toString(ma), getLabelledRegressionCoefficients(), getAic(), getBic());
    }
}
