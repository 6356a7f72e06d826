package turnstile.core.model.ratelimit;

import java.time.Instant;

/**
 * Fixed window rate limiting.
 *
 * <p>Time is cut into aligned windows of {@code windowSeconds}; each window has its own
 * storage key ({@code baseKey:windowIndex}) and counter. A request is admitted when
 * {@code count + cost <= limit}. Rejected requests are not charged.
 */
public final class FixedWindowAlgorithm implements RateLimitAlgorithmHandler {

    private static final FixedWindowAlgorithm INSTANCE = new FixedWindowAlgorithm();

    private FixedWindowAlgorithm() {}

    public static FixedWindowAlgorithm getInstance() {
        return INSTANCE;
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.FIXED_WINDOW;
    }

    @Override
    public String storageKey(String baseKey, EffectiveRateLimit limit, long nowMillis) {
        return baseKey + ":" + Math.floorDiv(nowMillis, limit.windowMillis());
    }

    @Override
    public RateLimitEvaluation evaluate(
            RateLimitState currentState, EffectiveRateLimit limit, long cost, long nowMillis) {

        final var windowMillis = limit.windowMillis();
        final var windowStart = Math.floorDiv(nowMillis, windowMillis) * windowMillis;
        final var windowEnd = windowStart + windowMillis;
        final var resetAt = Instant.ofEpochMilli(windowEnd);
        final var count = currentCount(currentState, windowStart);

        if (cost == 0) {
            final var decision = RateLimitDecision.allow(
                    limit.limit(), limit.limit() - count, resetAt, limit.windowSeconds(), algorithm());
            return new RateLimitEvaluation(decision, currentState, windowEnd);
        }

        if (count + cost > limit.limit()) {
            final var decision = RateLimitDecision.rejected(
                    limit.limit(),
                    limit.limit() - count,
                    resetAt,
                    RateLimitAlgorithmHandler.secondsUntil(nowMillis, windowEnd),
                    limit.windowSeconds(),
                    algorithm());
            return new RateLimitEvaluation(decision, currentState, windowEnd);
        }

        final var newCount = count + cost;
        final var decision = RateLimitDecision.allow(
                limit.limit(), limit.limit() - newCount, resetAt, limit.windowSeconds(), algorithm());
        return new RateLimitEvaluation(decision, new WindowCounterState(windowStart, newCount), windowEnd);
    }

    private long currentCount(RateLimitState currentState, long windowStart) {
        if (currentState instanceof WindowCounterState state && state.windowStartMillis() == windowStart) {
            return state.count();
        }
        return 0;
    }
}
