package luxgrowth.ml;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class ArimaxEstimatorTest {

    private final ArimaxEstimator estimator = new ArimaxEstimator();

    @Nested
    @DisplayName("simulated AR(1) errors with one regressor")
    class Recovery {

        private final int n = 200;
        private final int[] years = Fixtures.years(1800, n);
        private final double[] x = Fixtures.cyclicalRegressor(n);
        private final SeriesStore series = SeriesStore.of(years, Fixtures.arWithRegressor(x, 42L));
        private final RegressorSet regressors = Fixtures.single("x", "x", x, years);

        @Test
        @DisplayName("recovers φ, β and the intercept")
        void recoversCoefficients() {
            FittedModel model = estimator.fit(series, ModelOrder.of(1, 0, 0), regressors);

            assertTrue(model.hasIntercept());
            assertEquals(0.6, model.getArCoefficients()[0], 0.15);
            assertEquals(3.0, model.getRegressionCoefficients()[0], 0.1);
            assertEquals(2.0, model.getIntercept(), 1.0);
            assertEquals(3.0, model.getLabelledRegressionCoefficients().get("x"), 0.1);
        }

        @Test
        @DisplayName("information criteria follow from the log-likelihood")
        void criteria() {
            FittedModel model = estimator.fit(series, ModelOrder.of(1, 0, 1), regressors);

            assertEquals(4, model.getParameterCount());
            assertEquals(n, model.getResiduals().length);
            assertEquals(-2 * model.getLogLikelihood() + 2 * 4, model.getAic(), 1e-9);
            assertEquals(-2 * model.getLogLikelihood() + 4 * Math.log(n), model.getBic(), 1e-9);
            assertTrue(ArmaPolynomials.isStationary(model.getArCoefficients()));
            assertTrue(ArmaPolynomials.isInvertible(model.getMaCoefficients()));
        }

        @Test
        @DisplayName("refitting gives identical coefficients")
        void deterministic() {
            FittedModel a = estimator.fit(series, ModelOrder.of(2, 0, 1), regressors);
            FittedModel b = estimator.fit(series, ModelOrder.of(2, 0, 1), regressors);
            assertArrayEquals(a.getArCoefficients(), b.getArCoefficients(), 0.0);
            assertArrayEquals(a.getMaCoefficients(), b.getMaCoefficients(), 0.0);
            assertEquals(a.getAic(), b.getAic(), 0.0);
        }
    }

    @Test
    @DisplayName("ARIMA(0,1,0) residuals are the first differences")
    void randomWalk() {
        SeriesStore series = SeriesStore.of(Fixtures.years(2000, 4), new double[] {1, 3, 2, 5});
        FittedModel model = estimator.fit(series, ModelOrder.of(0, 1, 0), RegressorSet.empty("none", series.years()));

        assertFalse(model.hasIntercept(), "no constant once differenced");
        assertArrayEquals(new double[] {2, -1, 3}, model.getResiduals(), 1e-12);
        assertArrayEquals(new int[] {2001, 2002, 2003}, model.getResidualYears());
        assertArrayEquals(new double[] {1, 3, 2}, model.getFittedValues(), 1e-12);
        assertEquals(14.0 / 3.0, model.getSigma2(), 1e-12);
        assertEquals(0, model.getParameterCount());
        double logLik = -1.5 * (Math.log(2 * Math.PI * 14.0 / 3.0) + 1);
        assertEquals(logLik, model.getLogLikelihood(), 1e-12);
        assertEquals(-2 * logLik, model.getAic(), 1e-12);
    }

    @Test
    @DisplayName("residual count is n − d for every fitted order")
    void residualLength() {
        SeriesStore series = Fixtures.growth();
        RegressorSet regressors = Fixtures.gdpGini();
        for (ModelOrder order : Arrays.asList(ModelOrder.of(1, 1, 0), ModelOrder.of(0, 2, 1), ModelOrder.of(1, 0, 1))) {
            FittedModel model = estimator.fit(series, order, regressors);
            assertEquals(series.size() - order.getD(), model.getResiduals().length, order.toString());
            assertTrue(Double.isFinite(model.getAic()), order.toString());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("too few observations for the parameters → ESTIMATION_FAILURE")
        void tooShort() {
            SeriesStore series = SeriesStore.of(Fixtures.years(2000, 4), new double[] {1, 3, 2, 5});
            ModelingException e = assertThrows(ModelingException.class,
                () -> estimator.fit(series, ModelOrder.of(1, 1, 1), RegressorSet.empty("none", series.years())));
            assertEquals(ErrorKind.ESTIMATION_FAILURE, e.getKind());
            assertTrue(e.isRecoverable());
        }

        @Test
        @DisplayName("constant regressor next to the intercept → ESTIMATION_FAILURE")
        void singularDesign() {
            double[] flat = new double[20];
            Arrays.fill(flat, 1.0);
            RegressorSet regressors = Fixtures.single("flat", "Flat", flat, Fixtures.YEARS);
            ModelingException e = assertThrows(ModelingException.class,
                () -> estimator.fit(Fixtures.growth(), ModelOrder.of(1, 0, 0), regressors));
            assertEquals(ErrorKind.ESTIMATION_FAILURE, e.getKind());
        }

        @Test
        @DisplayName("regressors missing series years → DIMENSION_MISMATCH")
        void missingRows() {
            RegressorSet partial = Fixtures.gdpGini().slice(y -> y != 2010);
            ModelingException e = assertThrows(ModelingException.class,
                () -> estimator.fit(Fixtures.growth(), ModelOrder.of(1, 1, 0), partial));
            assertEquals(ErrorKind.DIMENSION_MISMATCH, e.getKind());
            assertFalse(e.isRecoverable());
        }

        @Test
        @DisplayName("design rows must match the differenced length")
        void designLength() {
            SeriesStore series = SeriesStore.of(Fixtures.years(2000, 4), new double[] {1, 3, 2, 5});
            RegressorSet none = RegressorSet.empty("none", series.years());
            ModelingException e = assertThrows(ModelingException.class, () -> new FittedModel(ModelOrder.of(0, 1, 0),
                series, none, new double[4][0], false, 0, new double[0], new double[0], new double[0]));
            assertEquals(ErrorKind.DIMENSION_MISMATCH, e.getKind());
        }
    }

    @Test
    @DisplayName("ALWAYS adds a drift term to differenced fits")
    void interceptPolicy() {
        ArimaxEstimator withDrift = new ArimaxEstimator(ArimaxEstimator.InterceptPolicy.ALWAYS, 5000);
        FittedModel model = withDrift.fit(Fixtures.growth(), ModelOrder.of(0, 1, 0), RegressorSet.empty("none", Fixtures.YEARS));
        assertTrue(model.hasIntercept());
        assertEquals(1, model.getParameterCount());
        // drift is the mean first difference: (21 − 2) / 19
        assertEquals(1.0, model.getIntercept(), 1e-9);

        ArimaxEstimator without = new ArimaxEstimator(ArimaxEstimator.InterceptPolicy.NEVER, 5000);
        assertFalse(without.fit(Fixtures.growth(), ModelOrder.of(1, 0, 0), RegressorSet.empty("none", Fixtures.YEARS)).hasIntercept());
    }
}
