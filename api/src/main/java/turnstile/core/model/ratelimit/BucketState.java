package turnstile.core.model.ratelimit;

/**
 * Token bucket state.
 *
 * @param tokens           tokens currently in the bucket, never negative
 * @param lastRefillMillis when the bucket was last refilled (epoch millis)
 */
public record BucketState(double tokens, long lastRefillMillis) implements RateLimitState {

    public BucketState {
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must be non-negative");
        }
        if (lastRefillMillis < 0) {
            throw new IllegalArgumentException("lastRefillMillis must be non-negative");
        }
    }

    /**
     * Returns the state after refilling for the time elapsed since the last refill.
     *
     * <p>Refill is {@code elapsedMillis * limit / windowMillis} so that waiting one full
     * window restores exactly {@code limit} tokens.
     *
     * @param capacity      bucket capacity
     * @param windowMillis  window over which {@code capacity} tokens are refilled
     * @param nowMillis     current time
     * @return the refilled state
     */
    public BucketState refill(long capacity, long windowMillis, long nowMillis) {
        final var elapsed = Math.max(0, nowMillis - lastRefillMillis);
        final var added = elapsed * (double) capacity / windowMillis;
        return new BucketState(Math.min(capacity, tokens + added), Math.max(nowMillis, lastRefillMillis));
    }

    /**
     * Returns the state after removing {@code cost} tokens.
     *
     * @param cost tokens to remove
     * @return the new state
     * @throws IllegalStateException if fewer than {@code cost} tokens are available
     */
    public BucketState consume(long cost) {
        if (tokens < cost) {
            throw new IllegalStateException("Not enough tokens to consume " + cost);
        }
        return new BucketState(tokens - cost, lastRefillMillis);
    }
}
