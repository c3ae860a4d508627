package luxgrowth.ml;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Non-seasonal ARIMA order (p, d, q). */
public final class ModelOrder {

    private final int p, d, q;

    public ModelOrder(int p, int d, int q) {
        if (p < 0 || d < 0 || q < 0) {
            throw new IllegalArgumentException("Orders must be non-negative: (" + p + "," + d + "," + q + ")");
        }
        this.p = p;
        this.d = d;
        this.q = q;
    }

    public static ModelOrder of(int p, int d, int q) {
        return new ModelOrder(p, d, q);
    }

    /** Parse "p,d,q" (whitespace and surrounding parentheses tolerated). */
    public static ModelOrder parse(String text) {
        String[] parts = text.replace("(", "").replace(")", "").trim().split("\\s*,\\s*");
        if (parts.length != 3) throw new IllegalArgumentException("Expected p,d,q but got '" + text + "'");
        try {
            return new ModelOrder(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected p,d,q but got '" + text + "'", e);
        }
    }

    /** Parse a grid written as "p,d,q; p,d,q; ...". */
    public static List<ModelOrder> parseGrid(String text) {
        List<ModelOrder> grid = new ArrayList<>();
        for (String item : text.split(";")) {
            if (!item.isBlank()) grid.add(parse(item));
        }
        return grid;
    }

    /** Every (p, d, q) with p and q drawn from the given ranges, p varying slowest. */
    public static List<ModelOrder> grid(int pFrom, int pTo, int d, int qFrom, int qTo) {
        List<ModelOrder> grid = new ArrayList<>();
        for (int p = pFrom; p <= pTo; p++) {
            for (int q = qFrom; q <= qTo; q++) grid.add(new ModelOrder(p, d, q));
        }
        return grid;
    }

    public int getP() { return p; }
    public int getD() { return d; }
    public int getQ() { return q; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelOrder)) return false;
        ModelOrder that = (ModelOrder) o;
        return p == that.p && d == that.d && q == that.q;
    }

    @Override
    public int hashCode() {
        return Objects.hash(p, d, q);
    }

    @Override
    public String toString() {
        return "(" + p + "," + d + "," + q + ")";
    }
}
