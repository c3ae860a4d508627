package luxgrowth.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of a grid search over one regressor set: successful fits and failures, each in
 * grid order. Rankings are computed views.
 */
public final class SearchResult {

    private final String regressorSetName;
    private final List<CandidateFit> successes;
    private final List<CandidateFailure> failures;

    public SearchResult(String regressorSetName, List<CandidateOutcome> outcomes) {
        this.regressorSetName = regressorSetName;
        List<CandidateOutcome> ordered = new ArrayList<>(outcomes);
        ordered.sort((a, b) -> Integer.compare(a.getGridIndex(), b.getGridIndex()));
        List<CandidateFit> ok = new ArrayList<>();
        List<CandidateFailure> failed = new ArrayList<>();
        for (CandidateOutcome outcome : ordered) {
            if (outcome instanceof CandidateFit) ok.add((CandidateFit) outcome);
            else failed.add((CandidateFailure) outcome);
        }
        this.successes = Collections.unmodifiableList(ok);
        this.failures = Collections.unmodifiableList(failed);
    }

    public String getRegressorSetName() { return regressorSetName; }
    public List<CandidateFit> getSuccesses() { return successes; }
    public List<CandidateFailure> getFailures() { return failures; }

    /** Number of grid entries evaluated (successes plus failures). */
    public int size() {
        return successes.size() + failures.size();
    }

    /** Diagnostically valid fits, best first. */
    public List<CandidateFit> ranked() {
        return successes.stream()
            .filter(CandidateFit::isValid)
            .sorted(CandidateFit.RANKING)
            .collect(Collectors.toList());
    }

    /** Every successful fit, valid or not, best first. */
    public List<CandidateFit> rankedByAic() {
        return successes.stream()
            .sorted(CandidateFit.RANKING)
            .collect(Collectors.toList());
    }

    public boolean hasValidCandidate() {
        return successes.stream().anyMatch(CandidateFit::isValid);
    }

    public Optional<CandidateFit> best() {
        return ranked().stream().findFirst();
    }

    /** Best valid fit, or the lowest-AIC fit when none is valid. */
    public Optional<CandidateFit> bestOrFallback() {
        Optional<CandidateFit> best = best();
        return best.isPresent() ? best : rankedByAic().stream().findFirst();
    }

    public Optional<CandidateFit> find(ModelOrder order) {
        return successes.stream().filter(c -> c.getOrder().equals(order)).findFirst();
    }

    /** Rows for every successful fit in ranking order. */
    public List<ModelTableRow> modelTable() {
        return rankedByAic().stream().map(CandidateFit::toRow).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "SearchResult[" + regressorSetName + ": " + successes.size() + " fitted ("
            + ranked().size() + " valid), " + failures.size() + " failed]";
    }
}
