package outbreak;

/**
 * Base of the analytical failures a pipeline step can report.
 * <p>
 * Per-pair forecasting chains catch this type and record it as a {@link FailureKind};
 * anything else is a programming error and propagates.
 */
public abstract class OutbreakException extends RuntimeException {

    private final FailureKind kind;

    protected OutbreakException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected OutbreakException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
