package outbreak;

/** Series too short for the chosen model, or degenerate (constant). */
public class InsufficientHistoryException extends OutbreakException {

    public InsufficientHistoryException(String message) {
        super(FailureKind.INSUFFICIENT_HISTORY, message);
    }
}
