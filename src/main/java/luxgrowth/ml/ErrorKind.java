package luxgrowth.ml;

/**
 * Failure categories raised by the modeling core.
 * <p>
 * Recoverable kinds are the ones a model search absorbs per candidate; every other kind is
 * fatal to the call that raised it.
 */
public enum ErrorKind {
    EMPTY_SERIES(false),
    DUPLICATE_YEAR(false),
    INVALID_WINDOW(false),
    INSUFFICIENT_LENGTH(false),
    REGRESSOR_MISALIGNMENT(false),
    YEAR_NOT_FOUND(false),
    DIMENSION_MISMATCH(false),
    ESTIMATION_FAILURE(true),
    INSUFFICIENT_SAMPLES(true),
    DIAGNOSTIC_INCONCLUSIVE(true),
    REGRESSOR_SHAPE_MISMATCH(false);

    private final boolean recoverable;

    ErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
