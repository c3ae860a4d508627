package luxgrowth.ml;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Lag-polynomial helpers for ARMA estimation and forecasting.
 * <p>
 * AR polynomial: φ(B) = 1 − φ₁B − … − φₚBᵖ. MA polynomial: θ(B) = 1 + θ₁B + … + θqB^q.
 * Unconstrained optimiser coordinates map to partial autocorrelations r = u/√(1+u²) and
 * then through the Durbin–Levinson recursion, so every point of ℝᵖ is a stationary AR
 * polynomial (and, with a sign flip, an invertible MA polynomial).
 */
final class ArmaPolynomials {

    /** Largest tolerated root modulus (of the reciprocal polynomial) before we call it unit-root. */
    static final double UNIT_ROOT_TOLERANCE = 1.0 - 1e-6;

    private ArmaPolynomials() { }

    static double[] toStationaryAr(double[] unconstrained) {
        int n = unconstrained.length;
        double[] phi = new double[n];
        for (int k = 0; k < n; k++) {
            double r = unconstrained[k] / Math.sqrt(1.0 + unconstrained[k] * unconstrained[k]);
            double[] prev = phi.clone();
            for (int i = 0; i < k; i++) phi[i] = prev[i] - r * prev[k - 1 - i];
            phi[k] = r;
        }
        return phi;
    }

    static double[] toInvertibleMa(double[] unconstrained) {
        double[] theta = toStationaryAr(unconstrained);
        for (int i = 0; i < theta.length; i++) theta[i] = -theta[i];
        return theta;
    }

    /**
     * Inverse of {@link #toStationaryAr}; returns null when the coefficients are not stationary.
     */
    static double[] fromStationaryAr(double[] phi) {
        int n = phi.length;
        double[] a = phi.clone();
        double[] r = new double[n];
        for (int k = n - 1; k >= 0; k--) {
            r[k] = a[k];
            double denom = 1.0 - r[k] * r[k];
            if (!(denom > 1e-12)) return null;
            double[] prev = new double[k];
            for (int i = 0; i < k; i++) prev[i] = (a[i] + r[k] * a[k - 1 - i]) / denom;
            a = prev;
        }
        double[] u = new double[n];
        for (int k = 0; k < n; k++) u[k] = r[k] / Math.sqrt(1.0 - r[k] * r[k]);
        return u;
    }

    static boolean isStationary(double[] phi) {
        return maxRootModulus(phi) < UNIT_ROOT_TOLERANCE;
    }

    static boolean isInvertible(double[] theta) {
        double[] negated = new double[theta.length];
        for (int i = 0; i < theta.length; i++) negated[i] = -theta[i];
        return maxRootModulus(negated) < UNIT_ROOT_TOLERANCE;
    }

    /**
     * Largest modulus among the roots of xᵖ − c₁xᵖ⁻¹ − … − cₚ, i.e. the eigenvalues of the
     * companion matrix. Values below one mean 1 − c₁B − … − cₚBᵖ has all roots outside the unit circle.
     */
    static double maxRootModulus(double[] c) {
        int n = c.length;
        if (n == 0) return 0.0;
        if (n == 1) return Math.abs(c[0]);
        RealMatrix companion = MatrixUtils.createRealMatrix(n, n);
        for (int j = 0; j < n; j++) companion.setEntry(0, j, c[j]);
        for (int i = 1; i < n; i++) companion.setEntry(i, i - 1, 1.0);
        try {
            EigenDecomposition eigen = new EigenDecomposition(companion);
            double[] re = eigen.getRealEigenvalues();
            double[] im = eigen.getImagEigenvalues();
            double max = 0.0;
            for (int i = 0; i < n; i++) max = Math.max(max, Math.hypot(re[i], im[i]));
            return max;
        } catch (MathIllegalStateException e) {
            return Double.POSITIVE_INFINITY;
        }
    }

    /**
     * ψ-weights ψ₀..ψ_{count−1} of the MA(∞) form of φ(B)(1−B)^d yₜ = θ(B)eₜ.
     */
    static double[] psiWeights(double[] phi, int d, double[] theta, int count) {
        double[] integratedAr = integratedAr(phi, d);
        double[] psi = new double[count];
        if (count == 0) return psi;
        psi[0] = 1.0;
        for (int j = 1; j < count; j++) {
            double v = j <= theta.length ? theta[j - 1] : 0.0;
            for (int i = 1; i <= Math.min(j, integratedAr.length); i++) v += integratedAr[i - 1] * psi[j - i];
            psi[j] = v;
        }
        return psi;
    }

    /** Coefficients φ*₁..φ*ₚ₊d of φ(B)(1−B)^d written as 1 − Σφ*ᵢBⁱ. */
    static double[] integratedAr(double[] phi, int d) {
        double[] poly = new double[phi.length + 1];
        poly[0] = 1.0;
        for (int i = 0; i < phi.length; i++) poly[i + 1] = -phi[i];
        for (int k = 0; k < d; k++) {
            double[] next = new double[poly.length + 1];
            for (int i = 0; i < poly.length; i++) {
                next[i] += poly[i];
                next[i + 1] -= poly[i];
            }
            poly = next;
        }
        double[] out = new double[poly.length - 1];
        for (int i = 1; i < poly.length; i++) out[i - 1] = -poly[i];
        return out;
    }
}
