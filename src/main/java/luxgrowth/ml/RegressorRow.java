package luxgrowth.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Values of named covariates for one period, in a fixed label order. */
public final class RegressorRow {

    private final List<String> labels;
    private final double[] values;

    public RegressorRow(List<String> labels, double[] values) {
        if (labels == null || values == null || labels.size() != values.length) {
            throw new IllegalArgumentException("labels and values must be non-null and the same length");
        }
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
        this.values = values.clone();
    }

    /** Row from an insertion-ordered map, e.g. hand-entered estimates for the forecast year. */
    public static RegressorRow of(Map<String, Double> valuesByLabel) {
        Map<String, Double> ordered = new LinkedHashMap<>(valuesByLabel);
        double[] values = new double[ordered.size()];
        int i = 0;
        for (Map.Entry<String, Double> e : ordered.entrySet()) {
            Double v = e.getValue();
            if (v == null || !Double.isFinite(v)) {
                throw new IllegalArgumentException("Covariate '" + e.getKey() + "' needs a finite value, got " + v);
            }
            values[i++] = v;
        }
        return new RegressorRow(new ArrayList<>(ordered.keySet()), values);
    }

    public List<String> labels() { return labels; }
    public double[] values() { return values.clone(); }
    public double get(int i) { return values[i]; }
    public int size() { return values.length; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(labels.get(i)).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }
}
