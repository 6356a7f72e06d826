package turnstile.core.model.admission;

/**
 * Where a request stopped in the admission pipeline.
 */
public enum AdmissionStage {
    AUTHENTICATION,
    RATE_LIMIT,
    PERMISSION,
    ADMITTED
}
