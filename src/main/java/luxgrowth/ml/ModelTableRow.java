package luxgrowth.ml;

import java.util.Locale;

/** One line of the ranked model table. */
public final class ModelTableRow {

    private final String regressorSet;
    private final String order;
    private final double aic;
    private final double bic;
    private final double ljungBoxP;
    private final double shapiroWilkP;
    private final double breuschPaganP;
    private final boolean valid;

    public ModelTableRow(String regressorSet, ModelOrder order, double aic, double bic,
                         double ljungBoxP, double shapiroWilkP, double breuschPaganP, boolean valid) {
        this.regressorSet = regressorSet;
        this.order = order.toString();
        this.aic = aic;
        this.bic = bic;
        this.ljungBoxP = ljungBoxP;
        this.shapiroWilkP = shapiroWilkP;
        this.breuschPaganP = breuschPaganP;
        this.valid = valid;
    }

    public static String header() {
        return String.format(Locale.ROOT, "%-16s %-9s %10s %10s %9s %9s %9s %6s",
            "regressors", "order", "AIC", "BIC", "LB p", "SW p", "BP p", "valid");
    }

    public String getRegressorSet() { return regressorSet; }
    public String getOrder() { return order; }
    public double getAic() { return aic; }
    public double getBic() { return bic; }
    public double getLjungBoxP() { return ljungBoxP; }
    public double getShapiroWilkP() { return shapiroWilkP; }
    public double getBreuschPaganP() { return breuschPaganP; }
    public boolean isValid() { return valid; }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%-16s %-9s %10.3f %10.3f %9.4f %9.4f %9.4f %6s",
            regressorSet, order, aic, bic, ljungBoxP, shapiroWilkP, breuschPaganP, valid ? "yes" : "no");
    }
}
