package luxgrowth.ml;

/** One raw (year, value) observation; the value may be missing (null or NaN). */
public final class SeriesPoint {

    private final int year;
    private final Double value;

    public SeriesPoint(int year, Double value) {
        this.year = year;
        this.value = value;
    }

    public static SeriesPoint of(int year, double value) {
        return new SeriesPoint(year, value);
    }

    public static SeriesPoint missing(int year) {
        return new SeriesPoint(year, null);
    }

    public int getYear() { return year; }
    public Double getValue() { return value; }

    /** True when the value is present and finite. */
    public boolean isValid() {
        return value != null && !value.isNaN() && !value.isInfinite();
    }

    @Override
    public String toString() {
        return year + "=" + value;
    }
}
