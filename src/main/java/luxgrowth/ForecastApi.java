package luxgrowth;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import luxgrowth.ml.ArimaxEstimator;
import luxgrowth.ml.CandidateFailure;
import luxgrowth.ml.CandidateFit;
import luxgrowth.ml.DiagnosticSuite;
import luxgrowth.ml.FittedModel;
import luxgrowth.ml.ForecastResult;
import luxgrowth.ml.ForecastSettings;
import luxgrowth.ml.Forecaster;
import luxgrowth.ml.ModelOrder;
import luxgrowth.ml.ModelSearch;
import luxgrowth.ml.ModelTableRow;
import luxgrowth.ml.ModelingException;
import luxgrowth.ml.RegressorRow;
import luxgrowth.ml.RegressorSet;
import luxgrowth.ml.SearchResult;
import luxgrowth.ml.SeriesPoint;
import luxgrowth.ml.SeriesStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * JSON request handling behind {@link WebApp}, kept free of HTTP types.
 * <p>
 * Client errors (bad JSON, misaligned inputs, unknown orders) produce status 400 with an
 * {@code {"error": ...}} body. Non-finite numbers (p-values of inconclusive tests, undefined
 * percentage errors) are written as JSON null.
 */
public class ForecastApi {

    private static final Logger LOG = LoggerFactory.getLogger(ForecastApi.class);

    static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final ForecastSettings settings;

    public ForecastApi(ForecastSettings settings) {
        this.settings = settings;
    }

    /** Status code and JSON body. */
    public static final class Response {
        private final int status;
        private final String body;

        Response(int status, Object payload) {
            this.status = status;
            this.body = GSON.toJson(payload);
        }

        public int getStatus() { return status; }
        public String getBody() { return body; }
    }

    /** Series plus one regressor set, shared by both endpoints. */
    static class SeriesRequest {
        int[] years;
        Double[] growth;
        Map<String, double[]> regressors;
        String setName;
    }

    static final class SearchRequest extends SeriesRequest {
        List<String> grid;
        Double threshold;
    }

    static final class ForecastRequest extends SeriesRequest {
        String order;
        Integer forecastYear;
        Map<String, Double> future;
        Double actual;
        Double confidence;
    }

    public Response search(String body) {
        return handle(() -> {
            SearchRequest req = parse(body, SearchRequest.class);
            SeriesStore series = series(req);
            RegressorSet regressors = regressors(req);
            List<ModelOrder> grid = req.grid == null || req.grid.isEmpty()
                ? settings.getOrderGrid() : parseGrid(req.grid);
            double threshold = req.threshold != null ? req.threshold : settings.getThreshold();
            ModelSearch search = new ModelSearch(ArimaxEstimator.from(settings),
                new DiagnosticSuite(threshold, settings.getLjungBoxLags()), settings.getThreads());
            SearchResult result = search.search(series, regressors, grid);

            Map<String, Object> out = new LinkedHashMap<>();
            out.put("regressorSet", regressors.name());
            List<Map<String, Object>> table = new ArrayList<>();
            for (ModelTableRow row : result.modelTable()) table.add(tableRow(row));
            out.put("table", table);
            List<Map<String, Object>> failures = new ArrayList<>();
            for (CandidateFailure f : result.getFailures()) {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("order", f.getOrder().toString());
                m.put("kind", f.getKind().name());
                m.put("reason", f.getReason());
                failures.add(m);
            }
            out.put("failures", failures);
            out.put("hasValid", result.hasValidCandidate());
            result.bestOrFallback().ifPresent(best -> out.put("best", best.getOrder().toString()));
            return out;
        });
    }

    public Response forecast(String body) {
        return handle(() -> {
            ForecastRequest req = parse(body, ForecastRequest.class);
            if (req.order == null) throw new IllegalArgumentException("Missing 'order'");
            if (req.forecastYear == null) throw new IllegalArgumentException("Missing 'forecastYear'");
            int forecastYear = req.forecastYear;
            SeriesStore series = series(req).window(forecastYear - 1);
            RegressorSet all = regressors(req);
            RegressorSet regressors = all.slice(year -> year < forecastYear);
            FittedModel model = ArimaxEstimator.from(settings).fit(series, ModelOrder.parse(req.order), regressors);

            RegressorRow row = req.future != null ? RegressorRow.of(req.future) : all.row(forecastYear);
            double confidence = req.confidence != null ? req.confidence : settings.getConfidence();
            ForecastResult result = Forecaster.from(settings).forecast(model, row, forecastYear - series.lastYear(), confidence);
            OptionalDouble observed = series(req).valueAt(forecastYear);
            if (req.actual != null) {
                result = result.withActual(req.actual);
            } else if (observed.isPresent()) {
                result = result.withActual(observed.getAsDouble());
            }

            Map<String, Object> out = new LinkedHashMap<>();
            out.put("order", result.getOrder().toString());
            out.put("year", result.getTargetYear());
            out.put("forecast", finite(result.getPointForecast()));
            out.put("lower", finite(result.getLowerBound()));
            out.put("upper", finite(result.getUpperBound()));
            out.put("confidence", result.getConfidence());
            out.put("standardError", finite(result.getStandardError()));
            if (result.hasActual()) {
                out.put("actual", result.getActual());
                out.put("absoluteError", finite(result.getAbsoluteError()));
                out.put("percentageError", finite(result.getPercentageError()));
            }
            out.put("aic", finite(model.getAic()));
            out.put("bic", finite(model.getBic()));
            out.put("coefficients", model.getLabelledRegressionCoefficients());
            return out;
        });
    }

    public Response sample() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("years", SampleData.YEARS);
        out.put("growth", SampleData.GROWTH);
        out.put("regressors", SampleData.indicators());
        out.put("setName", "GDP+Gini+Inflation");
        return new Response(200, out);
    }

    public Response health(int port) {
        Map<String, Object> h = new HashMap<>();
        h.put("status", "ok");
        h.put("port", port);
        return new Response(200, h);
    }

    private static Response handle(Supplier<Object> handler) {
        try {
            return new Response(200, handler.get());
        } catch (ModelingException e) {
            LOG.info("Rejected request: {}", e.toString());
            return error(400, e.getKind() + ": " + e.getMessage());
        } catch (JsonParseException | IllegalArgumentException e) {
            LOG.info("Rejected request: {}", e.getMessage());
            return error(400, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static Map<String, Object> tableRow(ModelTableRow row) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("regressorSet", row.getRegressorSet());
        m.put("order", row.getOrder());
        m.put("aic", finite(row.getAic()));
        m.put("bic", finite(row.getBic()));
        m.put("ljungBoxP", finite(row.getLjungBoxP()));
        m.put("shapiroWilkP", finite(row.getShapiroWilkP()));
        m.put("breuschPaganP", finite(row.getBreuschPaganP()));
        m.put("valid", row.isValid());
        return m;
    }

    /** Null for NaN and infinities, which JSON cannot carry. */
    static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static Response error(int status, String message) {
        return new Response(status, Collections.singletonMap("error", message));
    }

    private static <T> T parse(String body, Class<T> type) {
        if (body == null || body.isBlank()) throw new IllegalArgumentException("Missing request body");
        T req = GSON.fromJson(body, type);
        if (req == null) throw new IllegalArgumentException("Invalid JSON");
        return req;
    }

    private static SeriesStore series(SeriesRequest req) {
        if (req.years == null || req.growth == null) throw new IllegalArgumentException("Missing 'years' or 'growth'");
        if (req.years.length != req.growth.length) {
            throw new IllegalArgumentException("'years' and 'growth' differ in length");
        }
        List<SeriesPoint> points = new ArrayList<>(req.years.length);
        for (int i = 0; i < req.years.length; i++) points.add(new SeriesPoint(req.years[i], req.growth[i]));
        return SeriesStore.load(points);
    }

    private static RegressorSet regressors(SeriesRequest req) {
        String name = req.setName != null ? req.setName : "regressors";
        Map<String, double[]> covariates = req.regressors != null ? req.regressors : Collections.emptyMap();
        return RegressorSet.build(name, covariates, req.years);
    }

    private static List<ModelOrder> parseGrid(List<String> grid) {
        List<ModelOrder> orders = new ArrayList<>(grid.size());
        for (String item : grid) orders.add(ModelOrder.parse(item));
        return orders;
    }
}
