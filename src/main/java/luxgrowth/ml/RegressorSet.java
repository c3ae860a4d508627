package luxgrowth.ml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Named, year-aligned matrix of exogenous covariates.
 * <p>
 * Rows are keyed by year; lookups go through the year index, never through position alone.
 * Column order is the insertion order of the covariate map.
 */
public final class RegressorSet {

    private final String name;
    private final List<String> labels;
    private final int[] years;
    private final double[][] columns; // columns[j][row]

    private RegressorSet(String name, List<String> labels, int[] years, double[][] columns) {
        this.name = name;
        this.labels = Collections.unmodifiableList(labels);
        this.years = years;
        this.columns = columns;
    }

    /**
     * @throws ModelingException {@link ErrorKind#REGRESSOR_MISALIGNMENT} if a covariate's length
     *                           differs from the number of years
     */
    public static RegressorSet build(String name, Map<String, double[]> covariates, int[] years) {
        if (name == null || covariates == null || years == null) {
            throw new IllegalArgumentException("name, covariates and years are required");
        }
        for (int i = 1; i < years.length; i++) {
            if (years[i] <= years[i - 1]) {
                throw new IllegalArgumentException("Years must be strictly increasing: " + Arrays.toString(years));
            }
        }
        Map<String, double[]> ordered = new LinkedHashMap<>(covariates);
        double[][] columns = new double[ordered.size()][];
        int j = 0;
        for (Map.Entry<String, double[]> e : ordered.entrySet()) {
            double[] column = e.getValue();
            if (column == null || column.length != years.length) {
                throw new ModelingException(ErrorKind.REGRESSOR_MISALIGNMENT,
                    "Covariate '" + e.getKey() + "' in set '" + name + "' has "
                        + (column == null ? 0 : column.length) + " values for " + years.length + " years");
            }
            columns[j++] = column.clone();
        }
        return new RegressorSet(name, new ArrayList<>(ordered.keySet()), years.clone(), columns);
    }

    /** A set with no covariates, for plain ARIMA fits. */
    public static RegressorSet empty(String name, int[] years) {
        return build(name, Collections.emptyMap(), years);
    }

    /** Rows whose year satisfies the predicate, column order preserved. */
    public RegressorSet slice(IntPredicate yearPredicate) {
        int[] keep = new int[years.length];
        int count = 0;
        for (int i = 0; i < years.length; i++) {
            if (yearPredicate.test(years[i])) keep[count++] = i;
        }
        int[] slicedYears = new int[count];
        double[][] slicedColumns = new double[columns.length][count];
        for (int r = 0; r < count; r++) {
            slicedYears[r] = years[keep[r]];
            for (int j = 0; j < columns.length; j++) slicedColumns[j][r] = columns[j][keep[r]];
        }
        return new RegressorSet(name, new ArrayList<>(labels), slicedYears, slicedColumns);
    }

    /**
     * @throws ModelingException {@link ErrorKind#YEAR_NOT_FOUND} if the year has no row
     */
    public RegressorRow row(int year) {
        int idx = Arrays.binarySearch(years, year);
        if (idx < 0) {
            throw new ModelingException(ErrorKind.YEAR_NOT_FOUND,
                "Regressor set '" + name + "' has no row for " + year);
        }
        double[] values = new double[columns.length];
        for (int j = 0; j < columns.length; j++) values[j] = columns[j][idx];
        return new RegressorRow(labels, values);
    }

    /**
     * Row matrix for the requested years, looked up by year.
     *
     * @throws ModelingException {@link ErrorKind#DIMENSION_MISMATCH} if any year has no row
     */
    public double[][] alignTo(int[] targetYears) {
        double[][] matrix = new double[targetYears.length][columns.length];
        List<Integer> missing = new ArrayList<>();
        for (int r = 0; r < targetYears.length; r++) {
            int idx = Arrays.binarySearch(years, targetYears[r]);
            if (idx < 0) {
                missing.add(targetYears[r]);
                continue;
            }
            for (int j = 0; j < columns.length; j++) matrix[r][j] = columns[j][idx];
        }
        if (!missing.isEmpty()) {
            throw new ModelingException(ErrorKind.DIMENSION_MISMATCH,
                "Regressor set '" + name + "' has " + (targetYears.length - missing.size()) + " of "
                    + targetYears.length + " required rows; missing years " + missing);
        }
        return matrix;
    }

    public double[] column(String label) {
        int j = labels.indexOf(label);
        if (j < 0) throw new IllegalArgumentException("Unknown covariate: " + label);
        return columns[j].clone();
    }

    public String name() { return name; }
    public List<String> labels() { return labels; }
    public int[] years() { return years.clone(); }
    public int width() { return columns.length; }
    public int rowCount() { return years.length; }

    @Override
    public String toString() {
        return "RegressorSet[" + name + " " + labels + ", rows=" + years.length + "]";
    }
}
