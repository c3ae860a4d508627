package luxgrowth.data;

import luxgrowth.ml.ErrorKind;
import luxgrowth.ml.ModelingException;
import luxgrowth.ml.RegressorSet;
import luxgrowth.ml.SeriesPoint;
import luxgrowth.ml.SeriesStore;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Indicator table with one mean value per year and column.
 * <p>
 * Loaded from a CSV whose first line is a header and whose first column holds a year or a
 * date starting with the year (e.g. {@code 2015-03-31}). Several rows of the same year are
 * averaged per column; blank or non-numeric cells are missing and do not count.
 */
public final class AnnualTable {

    private static final Logger LOG = LoggerFactory.getLogger(AnnualTable.class);
    private static final Pattern YEAR = Pattern.compile("^\"?(\\d{4})");
    private static final String SEPARATORS = "[,;\t]";

    private final List<String> columns;
    private final TreeMap<Integer, Double[]> rows; // year -> value per column, null when missing

    private AnnualTable(List<String> columns, TreeMap<Integer, Double[]> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = rows;
    }

    public static AnnualTable fromCsv(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static AnnualTable parse(List<String> lines) {
        int headerIdx = 0;
        while (headerIdx < lines.size() && (lines.get(headerIdx).isBlank() || lines.get(headerIdx).trim().startsWith("#"))) {
            headerIdx++;
        }
        if (headerIdx == lines.size()) throw new IllegalArgumentException("Empty table");
        String[] header = lines.get(headerIdx).split(SEPARATORS, -1);
        if (header.length < 2) throw new IllegalArgumentException("Header needs a year column and at least one value column");
        List<String> columns = new ArrayList<>();
        for (int j = 1; j < header.length; j++) columns.add(unquote(header[j]));

        int width = columns.size();
        Map<Integer, double[]> sums = new TreeMap<>();
        Map<Integer, int[]> counts = new TreeMap<>();
        for (int i = headerIdx + 1; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            String[] parts = line.split(SEPARATORS, -1);
            Matcher m = YEAR.matcher(parts[0].trim());
            if (!m.find()) {
                LOG.debug("Skipping line {} without a year: {}", i + 1, line);
                continue;
            }
            int year = Integer.parseInt(m.group(1));
            double[] sum = sums.computeIfAbsent(year, y -> new double[width]);
            int[] count = counts.computeIfAbsent(year, y -> new int[width]);
            for (int j = 0; j < width && j + 1 < parts.length; j++) {
                Double v = parseCell(parts[j + 1]);
                if (v != null) {
                    sum[j] += v;
                    count[j]++;
                }
            }
        }

        TreeMap<Integer, Double[]> rows = new TreeMap<>();
        for (Map.Entry<Integer, double[]> e : sums.entrySet()) {
            int[] count = counts.get(e.getKey());
            Double[] means = new Double[width];
            for (int j = 0; j < width; j++) means[j] = count[j] > 0 ? e.getValue()[j] / count[j] : null;
            rows.put(e.getKey(), means);
        }
        LOG.info("Loaded {} years x {} columns", rows.size(), width);
        return new AnnualTable(columns, rows);
    }

    private static Double parseCell(String cell) {
        String s = unquote(cell);
        if (s.isEmpty()) return null;
        try {
            double v = Double.parseDouble(s);
            return Double.isFinite(v) ? v : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String unquote(String s) {
        String t = s.trim();
        if (t.length() >= 2 && t.startsWith("\"") && t.endsWith("\"")) t = t.substring(1, t.length() - 1).trim();
        return t;
    }

    public List<String> columns() { return columns; }

    public int[] years() {
        return rows.keySet().stream().mapToInt(Integer::intValue).toArray();
    }

    public OptionalDouble value(int year, String column) {
        Double[] row = rows.get(year);
        if (row == null) return OptionalDouble.empty();
        Double v = row[indexOf(column)];
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    /** The column as a series; years without a value are dropped. */
    public SeriesStore series(String column) {
        int j = indexOf(column);
        List<SeriesPoint> points = new ArrayList<>(rows.size());
        for (Map.Entry<Integer, Double[]> e : rows.entrySet()) points.add(new SeriesPoint(e.getKey(), e.getValue()[j]));
        return SeriesStore.load(points);
    }

    /**
     * Regressor set over exactly the given years.
     *
     * @throws ModelingException {@link ErrorKind#REGRESSOR_MISALIGNMENT} if a column has no value for one of the years
     */
    public RegressorSet regressors(String name, int[] years, List<String> regressorColumns) {
        Map<String, double[]> covariates = new LinkedHashMap<>();
        for (String column : regressorColumns) {
            double[] values = new double[years.length];
            for (int r = 0; r < years.length; r++) {
                OptionalDouble v = value(years[r], column);
                if (v.isEmpty()) {
                    throw new ModelingException(ErrorKind.REGRESSOR_MISALIGNMENT,
                        "Column '" + column + "' has no value for " + years[r]);
                }
                values[r] = v.getAsDouble();
            }
            covariates.put(column, values);
        }
        return RegressorSet.build(name, covariates, years);
    }

    /**
     * Pearson correlation of every other column with {@code target}, over the years where both
     * have values. NaN when fewer than three such years exist or a column is constant.
     */
    public Map<String, Double> correlations(String target) {
        int t = indexOf(target);
        Map<String, Double> out = new LinkedHashMap<>();
        PearsonsCorrelation pearson = new PearsonsCorrelation();
        for (int j = 0; j < columns.size(); j++) {
            if (j == t) continue;
            List<double[]> pairs = new ArrayList<>();
            for (Double[] row : rows.values()) {
                if (row[t] != null && row[j] != null) pairs.add(new double[] {row[t], row[j]});
            }
            double r = Double.NaN;
            if (pairs.size() >= 3) {
                double[] x = new double[pairs.size()];
                double[] y = new double[pairs.size()];
                for (int i = 0; i < pairs.size(); i++) {
                    x[i] = pairs.get(i)[0];
                    y[i] = pairs.get(i)[1];
                }
                r = pearson.correlation(x, y);
            }
            out.put(columns.get(j), r);
        }
        return out;
    }

    private int indexOf(String column) {
        int j = columns.indexOf(column);
        if (j < 0) throw new IllegalArgumentException("Unknown column '" + column + "'; have " + columns);
        return j;
    }

    @Override
    public String toString() {
        return "AnnualTable" + Arrays.toString(years()) + columns;
    }
}
