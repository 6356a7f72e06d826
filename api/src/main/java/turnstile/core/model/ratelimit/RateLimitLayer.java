package turnstile.core.model.ratelimit;

/**
 * The limit layer that produced a rejection.
 */
public enum RateLimitLayer {
    PER_KEY("per_key", "rate_limit_exceeded"),
    GLOBAL("global", "global_rate_limit_exceeded"),
    ENDPOINT("endpoint", "endpoint_rate_limit_exceeded");

    private final String wireName;
    private final String errorType;

    RateLimitLayer(String wireName, String errorType) {
        this.wireName = wireName;
        this.errorType = errorType;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Error type used in the 429 response body.
     *
     * @return the error type
     */
    public String errorType() {
        return errorType;
    }
}
