package luxgrowth.ml;

import org.apache.commons.math3.distribution.NormalDistribution;

import java.util.Arrays;

/**
 * Shapiro–Wilk normality test using Royston's (1995) coefficient and p-value approximations
 * (algorithm AS R94), valid for 3 ≤ n ≤ 5000.
 */
public final class ShapiroWilkTest {

    public static final String NAME = "Shapiro-Wilk";
    public static final int MIN_SAMPLES = 3;
    public static final int MAX_SAMPLES = 5000;

    private static final double[] C1 = {0.0, 0.221157, -0.147981, -2.071190, 4.434685, -2.706056};
    private static final double[] C2 = {0.0, 0.042981, -0.293762, -1.752461, 5.682633, -3.582633};
    private static final double[] G = {-2.273, 0.459};
    private static final double[] C3 = {0.5440, -0.39978, 0.025054, -6.714e-4};
    private static final double[] C4 = {1.3822, -0.77857, 0.062767, -0.0020322};
    private static final double[] C5 = {-1.5861, -0.31082, -0.083751, 0.0038915};
    private static final double[] C6 = {-0.4803, -0.082676, 0.0030302};

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution();

    private ShapiroWilkTest() { }

    /**
     * @throws ModelingException {@link ErrorKind#INSUFFICIENT_SAMPLES} below three observations,
     *                           {@link ErrorKind#DIAGNOSTIC_INCONCLUSIVE} above 5000 or for a constant sequence
     */
    public static TestOutcome test(double[] residuals) {
        int n = residuals.length;
        if (n < MIN_SAMPLES) {
            throw new ModelingException(ErrorKind.INSUFFICIENT_SAMPLES,
                "Shapiro-Wilk needs at least " + MIN_SAMPLES + " residuals, got " + n);
        }
        if (n > MAX_SAMPLES) {
            throw new ModelingException(ErrorKind.DIAGNOSTIC_INCONCLUSIVE,
                "Shapiro-Wilk approximation only holds up to " + MAX_SAMPLES + " residuals, got " + n);
        }
        double[] x = residuals.clone();
        Arrays.sort(x);
        double mean = 0;
        for (double v : x) mean += v;
        mean /= n;
        double ssq = 0;
        for (double v : x) ssq += (v - mean) * (v - mean);
        if (!(ssq > 0) || x[n - 1] - x[0] <= 0) {
            throw new ModelingException(ErrorKind.DIAGNOSTIC_INCONCLUSIVE, "Residuals have zero variance");
        }

        double[] a = coefficients(n);
        double numerator = 0;
        for (int i = 0; i < a.length; i++) numerator += a[i] * (x[n - 1 - i] - x[i]);
        double w = Math.min(1.0, numerator * numerator / ssq);
        return TestOutcome.of(NAME, w, pValue(w, n));
    }

    /** Half of the antisymmetric weight vector: weights for (x₍ₙ₋ᵢ₎ − x₍ᵢ₊₁₎), i = 0..n/2−1. */
    static double[] coefficients(int n) {
        int half = n / 2;
        double[] a = new double[half];
        if (n == 3) {
            a[0] = Math.sqrt(0.5);
            return a;
        }
        // m[i] holds the expected normal order statistic for rank n − i (largest first), all positive
        double[] m = new double[half];
        double summ2 = 0;
        for (int i = 0; i < half; i++) {
            m[i] = -STANDARD_NORMAL.inverseCumulativeProbability((i + 1 - 0.375) / (n + 0.25));
            summ2 += m[i] * m[i];
        }
        summ2 *= 2;
        double ssumm2 = Math.sqrt(summ2);
        double rsn = 1.0 / Math.sqrt(n);
        double a1 = poly(C1, rsn) + m[0] / ssumm2;

        int first;
        double fac;
        if (n > 5) {
            first = 2;
            double a2 = m[1] / ssumm2 + poly(C2, rsn);
            fac = Math.sqrt((summ2 - 2 * m[0] * m[0] - 2 * m[1] * m[1]) / (1 - 2 * a1 * a1 - 2 * a2 * a2));
            a[1] = a2;
        } else {
            first = 1;
            fac = Math.sqrt((summ2 - 2 * m[0] * m[0]) / (1 - 2 * a1 * a1));
        }
        a[0] = a1;
        for (int i = first; i < half; i++) a[i] = m[i] / fac;
        return a;
    }

    static double pValue(double w, int n) {
        if (n == 3) {
            double p = 6.0 / Math.PI * (Math.asin(Math.sqrt(w)) - Math.PI / 3.0);
            return Math.max(0.0, Math.min(1.0, p));
        }
        double y = Math.log(1.0 - w);
        double mu, sigma;
        if (n <= 11) {
            double gamma = poly(G, n);
            if (y >= gamma) return 0.0;
            y = -Math.log(gamma - y);
            mu = poly(C3, n);
            sigma = Math.exp(poly(C4, n));
        } else {
            double ln = Math.log(n);
            mu = poly(C5, ln);
            sigma = Math.exp(poly(C6, ln));
        }
        return 1.0 - STANDARD_NORMAL.cumulativeProbability((y - mu) / sigma);
    }

    private static double poly(double[] c, double x) {
        double result = 0;
        for (int i = c.length - 1; i >= 0; i--) result = result * x + c[i];
        return result;
    }
}
