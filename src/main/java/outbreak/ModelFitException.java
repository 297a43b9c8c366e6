package outbreak;

/** The likelihood optimizer failed to reach a finite optimum within its evaluation budget. */
public class ModelFitException extends OutbreakException {

    public ModelFitException(String message) {
        super(FailureKind.MODEL_FIT, message);
    }

    public ModelFitException(String message, Throwable cause) {
        super(FailureKind.MODEL_FIT, message, cause);
    }
}
