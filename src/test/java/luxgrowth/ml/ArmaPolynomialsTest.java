package luxgrowth.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArmaPolynomialsTest {

    @Test
    @DisplayName("any unconstrained point maps to a stationary AR and an invertible MA")
    void reparameterisationStaysInside() {
        double[][] points = {{0.0}, {7.9, -7.9}, {-3, 2, 5}, {1, 1, 1, 1}};
        for (double[] u : points) {
            assertTrue(ArmaPolynomials.isStationary(ArmaPolynomials.toStationaryAr(u)));
            assertTrue(ArmaPolynomials.isInvertible(ArmaPolynomials.toInvertibleMa(u)));
        }
    }

    @Test
    @DisplayName("fromStationaryAr() inverts toStationaryAr() and rejects explosive coefficients")
    void inverse() {
        double[] phi = {0.5, -0.3};
        double[] u = ArmaPolynomials.fromStationaryAr(phi);
        assertNotNull(u);
        assertArrayEquals(phi, ArmaPolynomials.toStationaryAr(u), 1e-12);
        assertNull(ArmaPolynomials.fromStationaryAr(new double[] {1.2}));
    }

    @Test
    @DisplayName("unit and explosive roots are detected")
    void roots() {
        assertEquals(1.0, ArmaPolynomials.maxRootModulus(new double[] {1.0}), 1e-12);
        assertFalse(ArmaPolynomials.isStationary(new double[] {1.0}));
        assertFalse(ArmaPolynomials.isInvertible(new double[] {1.2}));
        assertTrue(ArmaPolynomials.isStationary(new double[] {0.5, -0.3}));
        // 1 − 0.5B − 0.5B² has a root at B = 1
        assertFalse(ArmaPolynomials.isStationary(new double[] {0.5, 0.5}));
    }

    @Test
    @DisplayName("ψ-weights of AR(1) decay geometrically, of a random walk stay at one")
    void psiWeights() {
        assertArrayEquals(new double[] {1, 0.5, 0.25, 0.125},
            ArmaPolynomials.psiWeights(new double[] {0.5}, 0, new double[0], 4), 1e-12);
        assertArrayEquals(new double[] {1, 1, 1},
            ArmaPolynomials.psiWeights(new double[0], 1, new double[0], 3), 1e-12);
        // ARMA(0,1): ψ = 1, θ, 0, ...
        assertArrayEquals(new double[] {1, 0.4, 0},
            ArmaPolynomials.psiWeights(new double[0], 0, new double[] {0.4}, 3), 1e-12);
    }

    @Test
    @DisplayName("(1 − B)² expands to 1 − 2B + B²")
    void integratedAr() {
        assertArrayEquals(new double[] {2, -1}, ArmaPolynomials.integratedAr(new double[0], 2), 1e-12);
        // (1 − 0.5B)(1 − B) = 1 − 1.5B + 0.5B²
        assertArrayEquals(new double[] {1.5, -0.5}, ArmaPolynomials.integratedAr(new double[] {0.5}, 1), 1e-12);
    }
}
