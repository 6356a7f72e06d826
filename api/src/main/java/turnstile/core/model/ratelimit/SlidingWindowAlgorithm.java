package turnstile.core.model.ratelimit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding window rate limiting over request timestamps.
 *
 * <p>Keeps one timestamp per admitted unit of cost. Timestamps at or before
 * {@code now - window} have aged out. A request is admitted when
 * {@code count + cost <= limit}.
 */
public final class SlidingWindowAlgorithm implements RateLimitAlgorithmHandler {

    private static final SlidingWindowAlgorithm INSTANCE = new SlidingWindowAlgorithm();

    private SlidingWindowAlgorithm() {}

    public static SlidingWindowAlgorithm getInstance() {
        return INSTANCE;
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.SLIDING_WINDOW;
    }

    @Override
    public RateLimitEvaluation evaluate(
            RateLimitState currentState, EffectiveRateLimit limit, long cost, long nowMillis) {

        final var windowMillis = limit.windowMillis();
        final var live = prune(currentState, nowMillis - windowMillis);
        final var count = live.size();

        if (cost == 0) {
            final var decision = RateLimitDecision.allow(
                    limit.limit(), limit.limit() - count, resetAt(live, windowMillis, nowMillis),
                    limit.windowSeconds(), algorithm());
            return new RateLimitEvaluation(decision, currentState, expiry(live, windowMillis, nowMillis));
        }

        if (count + cost > limit.limit()) {
            final var decision = RateLimitDecision.rejected(
                    limit.limit(),
                    limit.limit() - count,
                    resetAt(live, windowMillis, nowMillis),
                    retryAfter(live, limit, cost, nowMillis),
                    limit.windowSeconds(),
                    algorithm());
            return new RateLimitEvaluation(
                    decision, new SlidingWindowState(live), expiry(live, windowMillis, nowMillis));
        }

        final var updated = new ArrayList<>(live);
        for (var i = 0; i < cost; i++) {
            updated.add(nowMillis);
        }
        final var decision = RateLimitDecision.allow(
                limit.limit(), limit.limit() - updated.size(), resetAt(updated, windowMillis, nowMillis),
                limit.windowSeconds(), algorithm());
        return new RateLimitEvaluation(
                decision, new SlidingWindowState(updated), expiry(updated, windowMillis, nowMillis));
    }

    private List<Long> prune(RateLimitState currentState, long cutoffMillis) {
        if (!(currentState instanceof SlidingWindowState state)) {
            return List.of();
        }
        final var live = new ArrayList<Long>(state.count());
        for (var timestamp : state.timestamps()) {
            if (timestamp > cutoffMillis) {
                live.add(timestamp);
            }
        }
        return live;
    }

    private Instant resetAt(List<Long> live, long windowMillis, long nowMillis) {
        if (live.isEmpty()) {
            return Instant.ofEpochMilli(nowMillis + windowMillis);
        }
        return Instant.ofEpochMilli(live.get(0) + windowMillis);
    }

    private long expiry(List<Long> live, long windowMillis, long nowMillis) {
        if (live.isEmpty()) {
            return nowMillis;
        }
        return live.get(live.size() - 1) + windowMillis;
    }

    private long retryAfter(List<Long> live, EffectiveRateLimit limit, long cost, long nowMillis) {
        if (cost > limit.limit()) {
            return limit.windowSeconds();
        }
        final var mustExpire = (int) (live.size() + cost - limit.limit());
        final var freedAt = live.get(mustExpire - 1) + limit.windowMillis();
        return RateLimitAlgorithmHandler.secondsUntil(nowMillis, freedAt);
    }
}
