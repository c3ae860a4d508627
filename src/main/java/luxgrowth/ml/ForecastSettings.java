package luxgrowth.ml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Search, diagnostic and forecast settings.
 * <p>
 * Defaults come from {@code luxgrowth.properties} on the classpath. Any key can be overridden
 * by an environment variable named {@code LUXGROWTH_} plus the key upper-cased with dots
 * replaced by underscores (e.g. {@code LUXGROWTH_DIAGNOSTICS_THRESHOLD}); {@code PORT} also
 * sets {@code web.port}.
 */
public final class ForecastSettings {

    public static final String RESOURCE = "/luxgrowth.properties";

    private final double threshold;
    private final int ljungBoxLags;
    private final int horizon;
    private final double confidence;
    private final List<ModelOrder> orderGrid;
    private final int threads;
    private final int maxEvaluations;
    private final ArimaxEstimator.InterceptPolicy interceptPolicy;
    private final int port;

    private ForecastSettings(Properties props) {
        this.threshold = getDouble(props, "diagnostics.threshold", 0.05);
        this.ljungBoxLags = getInt(props, "diagnostics.ljungBoxLags", 10);
        this.horizon = getInt(props, "forecast.horizon", 1);
        this.confidence = getDouble(props, "forecast.confidence", 0.95);
        this.orderGrid = ModelOrder.parseGrid(props.getProperty("search.grid",
            "1,1,1; 1,1,2; 1,1,3; 2,1,1; 2,1,2; 2,1,3; 3,1,1; 3,1,2; 3,1,3"));
        this.threads = getInt(props, "search.threads", Runtime.getRuntime().availableProcessors());
        this.maxEvaluations = getInt(props, "estimator.maxEvaluations", 5000);
        this.interceptPolicy = ArimaxEstimator.InterceptPolicy.valueOf(
            props.getProperty("estimator.intercept", "auto").trim().toUpperCase(Locale.ROOT));
        this.port = getInt(props, "web.port", 7000);
        validate();
    }

    /** Classpath defaults with environment overrides. */
    public static ForecastSettings load() {
        return load(System.getenv());
    }

    static ForecastSettings load(Map<String, String> env) {
        Properties props = new Properties();
        try (InputStream in = ForecastSettings.class.getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        for (String key : props.stringPropertyNames()) {
            String override = env.get("LUXGROWTH_" + key.toUpperCase(Locale.ROOT).replace('.', '_'));
            if (override != null && !override.isBlank()) props.setProperty(key, override.trim());
        }
        String port = env.get("PORT");
        if (port != null && !port.isBlank()) props.setProperty("web.port", port.trim());
        return new ForecastSettings(props);
    }

    /** Built-in defaults only, ignoring the classpath file and the environment. */
    public static ForecastSettings defaults() {
        return new ForecastSettings(new Properties());
    }

    public static ForecastSettings of(Properties props) {
        return new ForecastSettings(props);
    }

    private void validate() {
        if (!(threshold > 0 && threshold < 1)) throw new IllegalArgumentException("diagnostics.threshold must be in (0,1): " + threshold);
        if (!(confidence > 0 && confidence < 1)) throw new IllegalArgumentException("forecast.confidence must be in (0,1): " + confidence);
        if (horizon < 1) throw new IllegalArgumentException("forecast.horizon must be positive: " + horizon);
        if (ljungBoxLags < 1) throw new IllegalArgumentException("diagnostics.ljungBoxLags must be positive: " + ljungBoxLags);
        if (threads < 1) throw new IllegalArgumentException("search.threads must be positive: " + threads);
        if (orderGrid.isEmpty()) throw new IllegalArgumentException("search.grid is empty");
    }

    private static int getInt(Properties props, String key, int def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " is not an integer: " + v, e);
        }
    }

    private static double getDouble(Properties props, String key, double def) {
        String v = props.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " is not a number: " + v, e);
        }
    }

    public double getThreshold() { return threshold; }
    public int getLjungBoxLags() { return ljungBoxLags; }
    public int getHorizon() { return horizon; }
    public double getConfidence() { return confidence; }
    public List<ModelOrder> getOrderGrid() { return orderGrid; }
    public int getThreads() { return threads; }
    public int getMaxEvaluations() { return maxEvaluations; }
    public ArimaxEstimator.InterceptPolicy getInterceptPolicy() { return interceptPolicy; }
    public int getPort() { return port; }
}
