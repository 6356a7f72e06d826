package turnstile.core.model.ratelimit;

/**
 * Fixed window state.
 *
 * @param windowStartMillis start of the window this count belongs to (epoch millis)
 * @param count             cost admitted in the window so far
 */
public record WindowCounterState(long windowStartMillis, long count) implements RateLimitState {

    public WindowCounterState {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
    }
}
