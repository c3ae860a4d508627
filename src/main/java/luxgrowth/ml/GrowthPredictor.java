package luxgrowth.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Ties the model search to the forecast for an annual growth series and its candidate
 * regressor sets: search every set, pick a model, refit it on the years before the forecast
 * year and forecast that year.
 */
public class GrowthPredictor {

    private static final Logger LOG = LoggerFactory.getLogger(GrowthPredictor.class);

    private final SeriesStore growth;
    private final Map<String, RegressorSet> regressorSets = new LinkedHashMap<>();
    private final ForecastSettings settings;
    private final ArimaxEstimator estimator;
    private final ModelSearch search;
    private final Forecaster forecaster;

    public GrowthPredictor(SeriesStore growth, Collection<RegressorSet> sets, ForecastSettings settings) {
        if (growth == null) throw new IllegalArgumentException("growth series required");
        if (sets == null || sets.isEmpty()) throw new IllegalArgumentException("at least one regressor set required");
        this.growth = growth;
        for (RegressorSet set : sets) {
            if (regressorSets.put(set.name(), set) != null) {
                throw new IllegalArgumentException("Duplicate regressor set name: " + set.name());
            }
        }
        this.settings = settings;
        this.estimator = ArimaxEstimator.from(settings);
        this.search = new ModelSearch(estimator, DiagnosticSuite.from(settings), settings.getThreads());
        this.forecaster = Forecaster.from(settings);
    }

    /** Search the configured grid against every regressor set, in insertion order. */
    public Map<String, SearchResult> searchAll() {
        return searchAll(settings.getOrderGrid());
    }

    public Map<String, SearchResult> searchAll(List<ModelOrder> grid) {
        Map<String, SearchResult> results = new LinkedHashMap<>();
        for (RegressorSet set : regressorSets.values()) {
            results.put(set.name(), search.search(growth, set, grid));
        }
        return results;
    }

    public SearchResult search(String setName, List<ModelOrder> grid) {
        return search.search(growth, regressorSet(setName), grid);
    }

    /**
     * Best candidate across several searches: the best valid fit when any exists, otherwise the
     * lowest-AIC fit regardless of diagnostics.
     */
    public static Optional<CandidateFit> selectBest(Collection<SearchResult> results) {
        List<CandidateFit> valid = new ArrayList<>();
        List<CandidateFit> all = new ArrayList<>();
        for (SearchResult result : results) {
            valid.addAll(result.ranked());
            all.addAll(result.getSuccesses());
        }
        List<CandidateFit> pool = valid.isEmpty() ? all : valid;
        if (valid.isEmpty() && !all.isEmpty()) {
            LOG.warn("No diagnostically valid model; falling back to the lowest AIC among {} fits", all.size());
        }
        return pool.stream().min(CandidateFit.RANKING);
    }

    /**
     * Refit the chosen order on the years before {@code forecastYear} and forecast that year.
     *
     * @param futureRow regressor values for the forecast year; when null the set's own row for that year is used
     * @throws ModelingException {@link ErrorKind#ESTIMATION_FAILURE} if the refit fails,
     *                           {@link ErrorKind#YEAR_NOT_FOUND} if no future row is available
     */
    public ForecastResult forecastYear(String setName, ModelOrder order, int forecastYear, RegressorRow futureRow) {
        RegressorSet regressors = regressorSet(setName);
        SeriesStore window = growth.window(forecastYear - 1);
        RegressorSet sliced = regressors.slice(year -> year <= forecastYear - 1);
        FittedModel refit = estimator.fit(window, order, sliced);
        LOG.info("Refit {} on {}..{}: {}", order, window.firstYear(), window.lastYear(), refit);

        RegressorRow row = futureRow != null ? futureRow : regressors.row(forecastYear);
        int horizon = forecastYear - window.lastYear();
        ForecastResult result = forecaster.forecast(refit, row, horizon, settings.getConfidence());
        OptionalDouble actual = growth.valueAt(forecastYear);
        if (actual.isPresent()) {
            result = result.withActual(actual.getAsDouble());
        }
        LOG.info("{}", result);
        return result;
    }

    public ForecastResult forecastYear(CandidateFit chosen, int forecastYear, RegressorRow futureRow) {
        return forecastYear(chosen.getModel().getRegressors().name(), chosen.getOrder(), forecastYear, futureRow);
    }

    public RegressorSet regressorSet(String name) {
        RegressorSet set = regressorSets.get(name);
        if (set == null) throw new IllegalArgumentException("Unknown regressor set: " + name);
        return set;
    }

    public Collection<RegressorSet> getRegressorSets() {
        return Collections.unmodifiableCollection(regressorSets.values());
    }

    public SeriesStore getGrowth() { return growth; }
    public ForecastSettings getSettings() { return settings; }
}
