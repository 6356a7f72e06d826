package turnstile.core.model.ratelimit;

/**
 * Plain counter maintained by {@code increment}.
 *
 * @param value the current count
 */
public record CounterState(long value) implements RateLimitState {}
