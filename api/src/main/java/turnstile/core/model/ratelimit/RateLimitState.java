package turnstile.core.model.ratelimit;

/**
 * Algorithm-specific state held by a rate limit store for one key.
 *
 * <p>Implementations are immutable; algorithms return a new state instead of mutating.
 */
public sealed interface RateLimitState
        permits CounterState, WindowCounterState, SlidingWindowState, SlidingLogState, BucketState {}
