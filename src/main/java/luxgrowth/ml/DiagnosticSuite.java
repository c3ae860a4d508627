package luxgrowth.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Runs the residual battery (autocorrelation, normality, heteroskedasticity) on a fitted model.
 * <p>
 * A test that cannot produce a p-value is reported inconclusive on its own; the remaining
 * tests still run. The verdict never changes the model.
 */
public class DiagnosticSuite {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticSuite.class);

    private final double threshold;
    private final int ljungBoxLags;

    public DiagnosticSuite() {
        this(0.05, 10);
    }

    public DiagnosticSuite(double threshold, int ljungBoxLags) {
        if (!(threshold > 0 && threshold < 1)) throw new IllegalArgumentException("threshold must be in (0,1): " + threshold);
        if (ljungBoxLags < 1) throw new IllegalArgumentException("ljungBoxLags must be positive: " + ljungBoxLags);
        this.threshold = threshold;
        this.ljungBoxLags = ljungBoxLags;
    }

    public static DiagnosticSuite from(ForecastSettings settings) {
        return new DiagnosticSuite(settings.getThreshold(), settings.getLjungBoxLags());
    }

    public DiagnosticVerdict evaluate(FittedModel model) {
        DiagnosticVerdict verdict = evaluate(model.getResiduals(), model.getDesign());
        LOG.debug("{} [{}]: {}", model.getOrder(), model.getRegressors().name(), verdict);
        return verdict;
    }

    /**
     * @param design regressor rows aligned with the residuals, used by the heteroskedasticity test
     */
    public DiagnosticVerdict evaluate(double[] residuals, double[][] design) {
        TestOutcome ljungBox = guarded(LjungBoxTest.NAME, () -> LjungBoxTest.test(residuals, ljungBoxLags));
        TestOutcome shapiroWilk = guarded(ShapiroWilkTest.NAME, () -> ShapiroWilkTest.test(residuals));
        TestOutcome breuschPagan = guarded(BreuschPaganTest.NAME, () -> BreuschPaganTest.test(residuals, design));
        return new DiagnosticVerdict(ljungBox, shapiroWilk, breuschPagan, threshold);
    }

    public double getThreshold() { return threshold; }
    public int getLjungBoxLags() { return ljungBoxLags; }

    private static TestOutcome guarded(String name, Supplier<TestOutcome> test) {
        try {
            return test.get();
        } catch (ModelingException e) {
            if (!e.isRecoverable()) throw e;
            return TestOutcome.inconclusive(name, e.getKind(), e.getMessage());
        }
    }
}
