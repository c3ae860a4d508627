package luxgrowth.ml;

import java.util.Locale;

/**
 * Out-of-sample forecast with a symmetric interval and, when the observed value is known,
 * its error.
 */
public final class ForecastResult {

    private final ModelOrder order;
    private final int targetYear;
    private final int horizon;
    private final double[] path;
    private final double standardError;
    private final double confidence;
    private final double lowerBound;
    private final double upperBound;
    private final Double actual;

    ForecastResult(ModelOrder order, int targetYear, double[] path, double standardError,
                   double confidence, double criticalValue, Double actual) {
        if (path.length == 0) throw new IllegalArgumentException("Forecast path is empty");
        this.order = order;
        this.targetYear = targetYear;
        this.horizon = path.length;
        this.path = path.clone();
        this.standardError = standardError;
        this.confidence = confidence;
        double point = path[path.length - 1];
        this.lowerBound = point - criticalValue * standardError;
        this.upperBound = point + criticalValue * standardError;
        this.actual = actual;
    }

    private ForecastResult(ForecastResult source, Double actual) {
        this.order = source.order;
        this.targetYear = source.targetYear;
        this.horizon = source.horizon;
        this.path = source.path;
        this.standardError = source.standardError;
        this.confidence = source.confidence;
        this.lowerBound = source.lowerBound;
        this.upperBound = source.upperBound;
        this.actual = actual;
    }

    /** Copy of this forecast scored against an observed value. */
    public ForecastResult withActual(double actual) {
        return new ForecastResult(this, actual);
    }

    public ModelOrder getOrder() { return order; }
    public int getTargetYear() { return targetYear; }
    public int getHorizon() { return horizon; }

    /** Forecast at the final step of the horizon. */
    public double getPointForecast() { return path[path.length - 1]; }

    /** Forecasts for steps 1..horizon. */
    public double[] getPath() { return path.clone(); }

    public double getStandardError() { return standardError; }
    public double getConfidence() { return confidence; }
    public double getLowerBound() { return lowerBound; }
    public double getUpperBound() { return upperBound; }

    public boolean hasActual() { return actual != null; }

    /** NaN when no actual value was supplied. */
    public double getActual() { return actual == null ? Double.NaN : actual; }

    /** |actual − forecast|; NaN without an actual value. */
    public double getAbsoluteError() {
        return actual == null ? Double.NaN : Math.abs(actual - getPointForecast());
    }

    /** 100·|actual − forecast|/|actual|; NaN without an actual value or when it is zero. */
    public double getPercentageError() {
        if (actual == null || actual == 0.0) return Double.NaN;
        return 100.0 * getAbsoluteError() / Math.abs(actual);
    }

    @Override
    public String toString() {
        String s = String.format(Locale.ROOT, "Forecast %s for %d: %.4f [%.4f, %.4f] at %.0f%%",
            order, targetYear, getPointForecast(), lowerBound, upperBound, confidence * 100);
        if (actual != null) {
            s += String.format(Locale.ROOT, ", actual %.4f, abs error %.4f, pct error %.2f%%",
                actual, getAbsoluteError(), getPercentageError());
        }
        return s;
    }
}
