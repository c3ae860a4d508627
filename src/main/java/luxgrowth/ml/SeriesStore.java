package luxgrowth.ml;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Ordered annual series of (year, value) observations.
 * <p>
 * Years are strictly increasing and unique. Gaps between years are allowed. Instances are
 * immutable: {@link #window(int)} returns a new store.
 */
public final class SeriesStore {

    private final int[] years;
    private final double[] values;

    private SeriesStore(int[] years, double[] values) {
        this.years = years;
        this.values = values;
    }

    /**
     * Build a series from raw points, dropping missing values and sorting by year.
     *
     * @throws ModelingException {@link ErrorKind#EMPTY_SERIES} if no valid point remains,
     *                           {@link ErrorKind#DUPLICATE_YEAR} if a year repeats
     */
    public static SeriesStore load(Collection<SeriesPoint> points) {
        if (points == null) throw new IllegalArgumentException("points required");
        List<SeriesPoint> valid = new ArrayList<>();
        for (SeriesPoint point : points) {
            if (point != null && point.isValid()) valid.add(point);
        }
        if (valid.isEmpty()) {
            throw new ModelingException(ErrorKind.EMPTY_SERIES, "No valid observations in series");
        }
        valid.sort(Comparator.comparingInt(SeriesPoint::getYear));

        int n = valid.size();
        int[] years = new int[n];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            years[i] = valid.get(i).getYear();
            values[i] = valid.get(i).getValue();
            if (i > 0 && years[i] == years[i - 1]) {
                throw new ModelingException(ErrorKind.DUPLICATE_YEAR,
                    "Year " + years[i] + " appears more than once");
            }
        }
        return new SeriesStore(years, values);
    }

    /** Convenience for parallel arrays; NaN entries count as missing. */
    public static SeriesStore of(int[] years, double[] values) {
        if (years == null || values == null || years.length != values.length) {
            throw new IllegalArgumentException("years and values must be non-null and the same length");
        }
        List<SeriesPoint> points = new ArrayList<>(years.length);
        for (int i = 0; i < years.length; i++) points.add(new SeriesPoint(years[i], values[i]));
        return load(points);
    }

    /**
     * Truncate to the years up to and including {@code endYear}.
     *
     * @throws ModelingException {@link ErrorKind#INVALID_WINDOW} if endYear precedes the first year
     */
    public SeriesStore window(int endYear) {
        if (endYear < years[0]) {
            throw new ModelingException(ErrorKind.INVALID_WINDOW,
                "Window end " + endYear + " precedes first year " + years[0]);
        }
        int end = 0;
        while (end < years.length && years[end] <= endYear) end++;
        return new SeriesStore(Arrays.copyOf(years, end), Arrays.copyOf(values, end));
    }

    /**
     * Successive differences of the given order; the result has {@code size() - order} values.
     *
     * @throws ModelingException {@link ErrorKind#INSUFFICIENT_LENGTH} if order &gt;= size()
     */
    public double[] difference(int order) {
        return difference(values, order);
    }

    static double[] difference(double[] series, int order) {
        if (order < 0) throw new IllegalArgumentException("Differencing order must be non-negative: " + order);
        if (order >= series.length) {
            throw new ModelingException(ErrorKind.INSUFFICIENT_LENGTH,
                "Cannot difference " + series.length + " values " + order + " times");
        }
        double[] z = series.clone();
        for (int k = 0; k < order; k++) {
            double[] out = new double[z.length - 1];
            for (int i = 1; i < z.length; i++) out[i - 1] = z[i] - z[i - 1];
            z = out;
        }
        return z;
    }

    public OptionalDouble valueAt(int year) {
        int idx = Arrays.binarySearch(years, year);
        return idx >= 0 ? OptionalDouble.of(values[idx]) : OptionalDouble.empty();
    }

    public boolean containsYear(int year) {
        return Arrays.binarySearch(years, year) >= 0;
    }

    public int[] years() { return years.clone(); }
    public double[] values() { return values.clone(); }
    public int size() { return years.length; }
    public int firstYear() { return years[0]; }
    public int lastYear() { return years[years.length - 1]; }

    @Override
    public String toString() {
        return "SeriesStore[" + firstYear() + ".." + lastYear() + ", n=" + size() + "]";
    }
}
