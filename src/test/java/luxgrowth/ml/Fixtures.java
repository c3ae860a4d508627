package luxgrowth.ml;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/** Shared test series. */
final class Fixtures {

    static final int[] YEARS = {
        2003, 2004, 2005, 2006, 2007, 2008, 2009, 2010, 2011, 2012,
        2013, 2014, 2015, 2016, 2017, 2018, 2019, 2020, 2021, 2022
    };
    static final double[] GROWTH = {
        2.0, 9.0, 8.0, 9.0, 10.0, 4.0, -8.0, 13.0, 13.0, 10.0,
        2.0, 3.0, 1.0, -1.0, 6.0, 5.0, 4.0, -23.0, 29.0, 21.0
    };
    static final double[] GDP = {
        4.3, 5.4, 4.9, 5.5, 5.6, 3.0, -0.1, 5.4, 4.3, 3.5,
        3.4, 3.6, 3.4, 3.3, 3.8, 3.6, 2.8, -2.8, 6.3, 3.5
    };
    static final double[] GINI = {
        38.2, 38.4, 38.5, 38.6, 38.8, 38.9, 38.7, 38.6, 38.5, 38.4,
        38.3, 38.3, 38.2, 38.1, 38.0, 38.0, 37.9, 38.4, 38.6, 38.5
    };

    private Fixtures() { }

    static SeriesStore growth() {
        return SeriesStore.of(YEARS, GROWTH);
    }

    static RegressorSet gdpGini() {
        Map<String, double[]> m = new LinkedHashMap<>();
        m.put("GDP", GDP);
        m.put("Gini", GINI);
        return RegressorSet.build("GDP+Gini", m, YEARS);
    }

    static int[] years(int first, int count) {
        int[] years = new int[count];
        for (int i = 0; i < count; i++) years[i] = first + i;
        return years;
    }

    /** yₜ = 2 + 3xₜ + wₜ, wₜ = 0.6wₜ₋₁ + εₜ, ε ~ N(0,1) from a seeded generator. */
    static double[] arWithRegressor(double[] x, long seed) {
        Random random = new Random(seed);
        double[] y = new double[x.length];
        double w = 0;
        for (int t = 0; t < x.length; t++) {
            w = 0.6 * w + random.nextGaussian();
            y[t] = 2 + 3 * x[t] + w;
        }
        return y;
    }

    static double[] cyclicalRegressor(int n) {
        double[] x = new double[n];
        for (int t = 0; t < n; t++) x[t] = 10 * Math.sin(t / 5.0) + 0.05 * t;
        return x;
    }

    static RegressorSet single(String name, String label, double[] values, int[] years) {
        Map<String, double[]> m = new LinkedHashMap<>();
        m.put(label, values);
        return RegressorSet.build(name, m, years);
    }
}
