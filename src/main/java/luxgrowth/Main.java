package luxgrowth;

import luxgrowth.data.AnnualTable;
import luxgrowth.ml.CandidateFailure;
import luxgrowth.ml.CandidateFit;
import luxgrowth.ml.ForecastResult;
import luxgrowth.ml.ForecastSettings;
import luxgrowth.ml.GrowthPredictor;
import luxgrowth.ml.ModelTableRow;
import luxgrowth.ml.ModelingException;
import luxgrowth.ml.RegressorRow;
import luxgrowth.ml.RegressorSet;
import luxgrowth.ml.SearchResult;
import luxgrowth.ml.SeriesStore;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Command-line report: indicator correlations, ranked ARIMAX models per regressor set, a
 * back-test of the chosen model on the last observed year and a forecast for the next year.
 * <p>
 * Usage: {@code Main [annual.csv [growthColumn]]}. Without arguments the built-in 2003–2022
 * figures are used.
 */
public class Main {

    public static void main(String[] args) {
        ForecastSettings settings = ForecastSettings.load();
        try {
            AnnualTable table;
            String growthColumn;
            if (args.length > 0 && args[0] != null && !args[0].trim().isEmpty()) {
                table = AnnualTable.fromCsv(Paths.get(args[0].trim()));
                growthColumn = args.length > 1 ? args[1].trim() : table.columns().get(0);
            } else {
                table = AnnualTable.parse(SampleData.csvLines());
                growthColumn = "Growth";
            }
            run(table, growthColumn, settings, args.length == 0);
        } catch (IOException e) {
            System.err.println("CSV error: " + e.getMessage());
            System.exit(1);
        } catch (ModelingException | IllegalArgumentException e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            System.err.println("Error: " + msg);
            System.exit(1);
        }
    }

    static void run(AnnualTable table, String growthColumn, ForecastSettings settings, boolean sampleEstimates) {
        SeriesStore growth = table.series(growthColumn);
        List<String> indicators = new ArrayList<>(table.columns());
        indicators.remove(growthColumn);

        System.out.println("=== Correlation with " + growthColumn + " ===");
        for (Map.Entry<String, Double> e : table.correlations(growthColumn).entrySet()) {
            System.out.printf("%-16s %7.3f%n", e.getKey(), e.getValue());
        }
        System.out.println();

        List<RegressorSet> sets = regressorSets(table, growth.years(), indicators);
        GrowthPredictor predictor = new GrowthPredictor(growth, sets, settings);
        Map<String, SearchResult> results = predictor.searchAll();

        System.out.println("=== Model search " + settings.getOrderGrid() + " ===");
        System.out.println(ModelTableRow.header());
        for (SearchResult result : results.values()) {
            for (ModelTableRow row : result.modelTable()) System.out.println(row);
            for (CandidateFailure f : result.getFailures()) {
                System.out.printf("%-16s %-9s failed: %s%n", result.getRegressorSetName(), f.getOrder(), f.getReason());
            }
        }
        System.out.println();

        Optional<CandidateFit> best = GrowthPredictor.selectBest(results.values());
        if (best.isEmpty()) {
            System.out.println("No model could be fitted; nothing to forecast.");
            return;
        }
        CandidateFit chosen = best.get();
        System.out.println("=== Selected model ===");
        System.out.println(chosen.getModel().getRegressors().name() + " " + chosen.getOrder()
            + (chosen.isValid() ? "" : " (fails diagnostics: " + chosen.getVerdict().describeFailures() + ")"));
        System.out.println(chosen.getModel());
        System.out.println();

        int lastYear = growth.lastYear();
        System.out.println("=== Back-test on " + lastYear + " ===");
        print(predictor.forecastYear(chosen, lastYear, null));

        RegressorSet set = chosen.getModel().getRegressors();
        RegressorRow next = sampleEstimates ? SampleData.nextYearRow(set) : tableRow(table, set, lastYear + 1);
        if (next != null) {
            System.out.println("=== Forecast for " + (lastYear + 1) + " with " + next + " ===");
            print(predictor.forecastYear(chosen, lastYear + 1, next));
        } else {
            System.out.println("No indicator values for " + (lastYear + 1) + "; skipping next-year forecast.");
        }
    }

    /** One set per indicator, plus all indicators together. */
    private static List<RegressorSet> regressorSets(AnnualTable table, int[] years, List<String> indicators) {
        Map<String, List<String>> choices = new LinkedHashMap<>();
        for (String column : indicators) choices.put(column, Collections.singletonList(column));
        if (indicators.size() > 1) choices.put(String.join("+", indicators), indicators);
        List<RegressorSet> sets = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : choices.entrySet()) {
            sets.add(table.regressors(e.getKey(), years, e.getValue()));
        }
        return sets;
    }

    private static RegressorRow tableRow(AnnualTable table, RegressorSet set, int year) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (String label : set.labels()) {
            OptionalDouble v = table.value(year, label);
            if (v.isEmpty()) return null;
            values.put(label, v.getAsDouble());
        }
        return RegressorRow.of(values);
    }

    private static void print(ForecastResult result) {
        System.out.printf("Forecast %.2f, %.0f%% interval [%.2f, %.2f]%n", result.getPointForecast(),
            result.getConfidence() * 100, result.getLowerBound(), result.getUpperBound());
        if (result.hasActual()) {
            System.out.printf("Actual %.2f, absolute error %.2f, percentage error %.2f%%%n",
                result.getActual(), result.getAbsoluteError(), result.getPercentageError());
        }
        System.out.println();
    }
}
