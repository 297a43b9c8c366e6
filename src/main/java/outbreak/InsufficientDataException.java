package outbreak;

/** Too few entities for the requested cluster count, or none at all. */
public class InsufficientDataException extends OutbreakException {

    public InsufficientDataException(String message) {
        super(FailureKind.INSUFFICIENT_DATA, message);
    }
}
