package turnstile.core.model.ratelimit;

/**
 * What to do when the rate limit store cannot answer.
 */
public enum FailurePolicy {
    /** Reject the request. */
    DENY,
    /** Admit the request. */
    ALLOW
}
