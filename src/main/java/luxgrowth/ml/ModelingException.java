package luxgrowth.ml;

/**
 * Unchecked failure of a series, regressor, estimation, diagnostic or forecast operation.
 */
public class ModelingException extends RuntimeException {

    private final ErrorKind kind;

    public ModelingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() { return kind; }

    public boolean isRecoverable() {
        return kind.isRecoverable();
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
