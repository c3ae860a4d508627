package luxgrowth.ml;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Outcomes of the three residual tests and the resulting validity flag.
 * <p>
 * {@code valid} is true exactly when every test produced a p-value strictly above the threshold.
 */
public final class DiagnosticVerdict {

    private final TestOutcome ljungBox;
    private final TestOutcome shapiroWilk;
    private final TestOutcome breuschPagan;
    private final double threshold;
    private final boolean valid;

    public DiagnosticVerdict(TestOutcome ljungBox, TestOutcome shapiroWilk, TestOutcome breuschPagan, double threshold) {
        this.ljungBox = ljungBox;
        this.shapiroWilk = shapiroWilk;
        this.breuschPagan = breuschPagan;
        this.threshold = threshold;
        this.valid = ljungBox.passes(threshold) && shapiroWilk.passes(threshold) && breuschPagan.passes(threshold);
    }

    public TestOutcome getLjungBox() { return ljungBox; }
    public TestOutcome getShapiroWilk() { return shapiroWilk; }
    public TestOutcome getBreuschPagan() { return breuschPagan; }
    public double getThreshold() { return threshold; }
    public boolean isValid() { return valid; }

    public List<TestOutcome> outcomes() {
        return Collections.unmodifiableList(Arrays.asList(ljungBox, shapiroWilk, breuschPagan));
    }

    /** Tests that did not pass, with their reason when inconclusive. */
    public String describeFailures() {
        StringBuilder sb = new StringBuilder();
        for (TestOutcome outcome : outcomes()) {
            if (outcome.passes(threshold)) continue;
            if (sb.length() > 0) sb.append("; ");
            if (outcome.isConclusive()) {
                sb.append(String.format("%s p=%.4f <= %.2f", outcome.getName(), outcome.getPValue(), threshold));
            } else {
                sb.append(outcome.getName()).append(' ').append(outcome.getReason());
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "DiagnosticVerdict[valid=" + valid + ", " + ljungBox + ", " + shapiroWilk + ", " + breuschPagan + "]";
    }
}
