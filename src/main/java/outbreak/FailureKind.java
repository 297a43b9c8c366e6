package outbreak;

/** Why a pipeline step produced no result. */
public enum FailureKind {
    INSUFFICIENT_DATA,
    INSUFFICIENT_HISTORY,
    MODEL_FIT,
    CONFIGURATION,
    /** History exists but no period ever reported a case. */
    NO_REPORTED_CASES
}
