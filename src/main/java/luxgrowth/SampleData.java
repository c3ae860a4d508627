package luxgrowth;

import luxgrowth.ml.RegressorRow;
import luxgrowth.ml.RegressorSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Built-in annual figures for the demo and the sample endpoint (2003–2022). */
final class SampleData {

    static final int[] YEARS = {
        2003, 2004, 2005, 2006, 2007, 2008, 2009, 2010, 2011, 2012,
        2013, 2014, 2015, 2016, 2017, 2018, 2019, 2020, 2021, 2022
    };

    /** Luxury-market growth rate, percent. */
    static final double[] GROWTH = {
        2.0, 9.0, 8.0, 9.0, 10.0, 4.0, -8.0, 13.0, 13.0, 10.0,
        2.0, 3.0, 1.0, -1.0, 6.0, 5.0, 4.0, -23.0, 29.0, 21.0
    };

    /** World GDP growth, percent. */
    static final double[] GDP = {
        4.3, 5.4, 4.9, 5.5, 5.6, 3.0, -0.1, 5.4, 4.3, 3.5,
        3.4, 3.6, 3.4, 3.3, 3.8, 3.6, 2.8, -2.8, 6.3, 3.5
    };

    /** Gini index. */
    static final double[] GINI = {
        38.2, 38.4, 38.5, 38.6, 38.8, 38.9, 38.7, 38.6, 38.5, 38.4,
        38.3, 38.3, 38.2, 38.1, 38.0, 38.0, 37.9, 38.4, 38.6, 38.5
    };

    /** Consumer price inflation, percent. */
    static final double[] INFLATION = {
        3.0, 3.6, 4.1, 4.3, 4.8, 8.9, 2.9, 3.3, 5.0, 4.0,
        3.0, 2.7, 1.7, 1.6, 2.2, 2.4, 2.2, 1.9, 3.5, 8.0
    };

    private SampleData() { }

    /** The same figures as an annual CSV, header first. */
    static List<String> csvLines() {
        List<String> lines = new ArrayList<>();
        lines.add("Year,Growth,GDP,Gini,Inflation");
        for (int i = 0; i < YEARS.length; i++) {
            lines.add(YEARS[i] + "," + GROWTH[i] + "," + GDP[i] + "," + GINI[i] + "," + INFLATION[i]);
        }
        return lines;
    }

    static Map<String, double[]> indicators() {
        Map<String, double[]> m = new LinkedHashMap<>();
        m.put("GDP", GDP);
        m.put("Gini", GINI);
        m.put("Inflation", INFLATION);
        return m;
    }

    /** Hand-entered indicator estimates for 2023, restricted to the labels of the given set. */
    static RegressorRow nextYearRow(RegressorSet set) {
        Map<String, Double> estimates = new LinkedHashMap<>();
        estimates.put("GDP", 3.1);
        estimates.put("Gini", 38.4);
        estimates.put("Inflation", 6.8);
        Map<String, Double> row = new LinkedHashMap<>();
        for (String label : set.labels()) row.put(label, estimates.get(label));
        return RegressorRow.of(row);
    }
}
