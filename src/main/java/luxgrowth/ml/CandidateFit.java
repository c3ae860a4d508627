package luxgrowth.ml;

import java.util.Comparator;

/** A successfully estimated candidate with its diagnostic verdict. */
public final class CandidateFit implements CandidateOutcome {

    /** AIC ascending, then BIC, then position in the grid. */
    public static final Comparator<CandidateFit> RANKING = Comparator
        .comparingDouble(CandidateFit::getAic)
        .thenComparingDouble(CandidateFit::getBic)
        .thenComparingInt(CandidateFit::getGridIndex);

    private final int gridIndex;
    private final FittedModel model;
    private final DiagnosticVerdict verdict;

    public CandidateFit(int gridIndex, FittedModel model, DiagnosticVerdict verdict) {
        this.gridIndex = gridIndex;
        this.model = model;
        this.verdict = verdict;
    }

    @Override
    public ModelOrder getOrder() { return model.getOrder(); }

    @Override
    public int getGridIndex() { return gridIndex; }

    @Override
    public boolean isSuccess() { return true; }

    public FittedModel getModel() { return model; }
    public DiagnosticVerdict getVerdict() { return verdict; }
    public double getAic() { return model.getAic(); }
    public double getBic() { return model.getBic(); }
    public boolean isValid() { return verdict.isValid(); }

    public ModelTableRow toRow() {
        return new ModelTableRow(model.getRegressors().name(), getOrder(), getAic(), getBic(),
            verdict.getLjungBox().getPValue(), verdict.getShapiroWilk().getPValue(),
            verdict.getBreuschPagan().getPValue(), verdict.isValid());
    }

    @Override
    public String toString() {
        return "CandidateFit" + getOrder() + "[aic=" + getAic() + ", valid=" + isValid() + "]";
    }
}
