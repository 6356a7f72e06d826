package turnstile.core.model.ratelimit;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import turnstile.core.model.ratelimit.SlidingLogState.LogEntry;

/**
 * Sliding log rate limiting: like the sliding window, but each admitted request is kept
 * once with its cost and costs are summed.
 */
public final class SlidingLogAlgorithm implements RateLimitAlgorithmHandler {

    private static final SlidingLogAlgorithm INSTANCE = new SlidingLogAlgorithm();

    private SlidingLogAlgorithm() {}

    public static SlidingLogAlgorithm getInstance() {
        return INSTANCE;
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.SLIDING_LOG;
    }

    @Override
    public RateLimitEvaluation evaluate(
            RateLimitState currentState, EffectiveRateLimit limit, long cost, long nowMillis) {

        final var windowMillis = limit.windowMillis();
        final var live = prune(currentState, nowMillis - windowMillis);
        final var used = live.totalCost();

        if (cost == 0) {
            final var decision = RateLimitDecision.allow(
                    limit.limit(), limit.limit() - used, resetAt(live, windowMillis, nowMillis),
                    limit.windowSeconds(), algorithm());
            return new RateLimitEvaluation(decision, currentState, expiry(live, windowMillis, nowMillis));
        }

        if (used + cost > limit.limit()) {
            final var decision = RateLimitDecision.rejected(
                    limit.limit(),
                    limit.limit() - used,
                    resetAt(live, windowMillis, nowMillis),
                    retryAfter(live, limit, used, cost, nowMillis),
                    limit.windowSeconds(),
                    algorithm());
            return new RateLimitEvaluation(decision, live, expiry(live, windowMillis, nowMillis));
        }

        final var entries = new ArrayList<>(live.entries());
        entries.add(new LogEntry(nowMillis, cost));
        final var updated = new SlidingLogState(entries);
        final var decision = RateLimitDecision.allow(
                limit.limit(), limit.limit() - (used + cost), resetAt(updated, windowMillis, nowMillis),
                limit.windowSeconds(), algorithm());
        return new RateLimitEvaluation(decision, updated, expiry(updated, windowMillis, nowMillis));
    }

    private SlidingLogState prune(RateLimitState currentState, long cutoffMillis) {
        if (!(currentState instanceof SlidingLogState state)) {
            return new SlidingLogState(List.of());
        }
        final var live = new ArrayList<LogEntry>(state.entries().size());
        for (var entry : state.entries()) {
            if (entry.timestampMillis() > cutoffMillis) {
                live.add(entry);
            }
        }
        return new SlidingLogState(live);
    }

    private Instant resetAt(SlidingLogState live, long windowMillis, long nowMillis) {
        if (live.entries().isEmpty()) {
            return Instant.ofEpochMilli(nowMillis + windowMillis);
        }
        return Instant.ofEpochMilli(live.entries().get(0).timestampMillis() + windowMillis);
    }

    private long expiry(SlidingLogState live, long windowMillis, long nowMillis) {
        final var entries = live.entries();
        if (entries.isEmpty()) {
            return nowMillis;
        }
        return entries.get(entries.size() - 1).timestampMillis() + windowMillis;
    }

    private long retryAfter(SlidingLogState live, EffectiveRateLimit limit, long used, long cost, long nowMillis) {
        if (cost > limit.limit()) {
            return limit.windowSeconds();
        }
        final var mustFree = used + cost - limit.limit();
        var freed = 0L;
        for (var entry : live.entries()) {
            freed += entry.cost();
            if (freed >= mustFree) {
                return RateLimitAlgorithmHandler.secondsUntil(
                        nowMillis, entry.timestampMillis() + limit.windowMillis());
            }
        }
        return limit.windowSeconds();
    }
}
