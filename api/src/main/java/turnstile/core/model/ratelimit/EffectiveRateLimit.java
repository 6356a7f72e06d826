package turnstile.core.model.ratelimit;

/**
 * A concrete limit to enforce.
 *
 * @param limit         admitted cost per window
 * @param windowSeconds window length in seconds
 */
public record EffectiveRateLimit(long limit, long windowSeconds) {

    public EffectiveRateLimit {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive");
        }
    }

    public static EffectiveRateLimit of(long limit, RateLimitPeriod period) {
        return new EffectiveRateLimit(limit, period.windowSeconds());
    }

    public long windowMillis() {
        return windowSeconds * 1000;
    }

    /**
     * Refill rate for the token bucket algorithm.
     *
     * @return tokens per second
     */
    public double refillRatePerSecond() {
        return (double) limit / windowSeconds;
    }
}
