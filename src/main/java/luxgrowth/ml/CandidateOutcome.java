package luxgrowth.ml;

/** Tagged result of evaluating one grid entry: either a {@link CandidateFit} or a {@link CandidateFailure}. */
public interface CandidateOutcome {

    ModelOrder getOrder();

    /** Position of the order in the searched grid. */
    int getGridIndex();

    boolean isSuccess();
}
