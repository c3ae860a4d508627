package luxgrowth.ml;

/** A grid entry whose estimation failed, was cancelled or timed out. */
public final class CandidateFailure implements CandidateOutcome {

    private final ModelOrder order;
    private final int gridIndex;
    private final ErrorKind kind;
    private final String reason;

    public CandidateFailure(ModelOrder order, int gridIndex, ErrorKind kind, String reason) {
        this.order = order;
        this.gridIndex = gridIndex;
        this.kind = kind;
        this.reason = reason;
    }

    @Override
    public ModelOrder getOrder() { return order; }

    @Override
    public int getGridIndex() { return gridIndex; }

    @Override
    public boolean isSuccess() { return false; }

    public ErrorKind getKind() { return kind; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return "CandidateFailure" + order + "[" + kind + ": " + reason + "]";
    }
}
