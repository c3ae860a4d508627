package luxgrowth.ml;

/**
 * Result of one residual test: a statistic and p-value, or the reason no p-value exists.
 */
public final class TestOutcome {

    private final String name;
    private final double statistic;
    private final double pValue;
    private final ErrorKind failureKind;
    private final String reason;

    private TestOutcome(String name, double statistic, double pValue, ErrorKind failureKind, String reason) {
        this.name = name;
        this.statistic = statistic;
        this.pValue = pValue;
        this.failureKind = failureKind;
        this.reason = reason;
    }

    public static TestOutcome of(String name, double statistic, double pValue) {
        return new TestOutcome(name, statistic, pValue, null, null);
    }

    public static TestOutcome inconclusive(String name, ErrorKind kind, String reason) {
        return new TestOutcome(name, Double.NaN, Double.NaN, kind, reason);
    }

    public String getName() { return name; }
    public double getStatistic() { return statistic; }

    /** NaN when the test is inconclusive. */
    public double getPValue() { return pValue; }

    public boolean isConclusive() { return failureKind == null; }

    /** {@link ErrorKind#INSUFFICIENT_SAMPLES} or {@link ErrorKind#DIAGNOSTIC_INCONCLUSIVE}; null when conclusive. */
    public ErrorKind getFailureKind() { return failureKind; }
    public String getReason() { return reason; }

    /** Strictly above the threshold; an inconclusive test never passes. */
    public boolean passes(double threshold) {
        return isConclusive() && pValue > threshold;
    }

    @Override
    public String toString() {
        if (!isConclusive()) return name + "[" + failureKind + ": " + reason + "]";
        return String.format("%s[stat=%.4f, p=%.4f]", name, statistic, pValue);
    }
}
