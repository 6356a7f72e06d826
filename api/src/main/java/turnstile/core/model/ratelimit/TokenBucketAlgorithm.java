package turnstile.core.model.ratelimit;

import java.time.Instant;

/**
 * Token bucket rate limiting.
 *
 * <p>Capacity is {@code limit}; the bucket refills at {@code limit / windowSeconds} tokens
 * per second and starts full. A request of cost {@code c} needs {@code c} tokens; when fewer
 * are available it is rejected and nothing is consumed.
 */
public final class TokenBucketAlgorithm implements RateLimitAlgorithmHandler {

    private static final TokenBucketAlgorithm INSTANCE = new TokenBucketAlgorithm();

    private TokenBucketAlgorithm() {}

    public static TokenBucketAlgorithm getInstance() {
        return INSTANCE;
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return RateLimitAlgorithm.TOKEN_BUCKET;
    }

    @Override
    public RateLimitEvaluation evaluate(
            RateLimitState currentState, EffectiveRateLimit limit, long cost, long nowMillis) {

        final var capacity = limit.limit();
        final var windowMillis = limit.windowMillis();
        final var refilled = resolveState(currentState, capacity, nowMillis).refill(capacity, windowMillis, nowMillis);

        if (cost == 0) {
            return new RateLimitEvaluation(
                    allowed(refilled, limit, nowMillis), currentState, expiry(refilled, limit, nowMillis));
        }

        if (refilled.tokens() < cost) {
            final var decision = RateLimitDecision.rejected(
                    capacity,
                    (long) Math.floor(refilled.tokens()),
                    resetAt(refilled, limit, nowMillis),
                    retryAfter(refilled, limit, cost),
                    limit.windowSeconds(),
                    algorithm());
            return new RateLimitEvaluation(decision, refilled, expiry(refilled, limit, nowMillis));
        }

        final var consumed = refilled.consume(cost);
        return new RateLimitEvaluation(
                allowed(consumed, limit, nowMillis), consumed, expiry(consumed, limit, nowMillis));
    }

    private BucketState resolveState(RateLimitState currentState, long capacity, long nowMillis) {
        if (currentState instanceof BucketState state) {
            return state;
        }
        return new BucketState(capacity, nowMillis);
    }

    private RateLimitDecision allowed(BucketState state, EffectiveRateLimit limit, long nowMillis) {
        return RateLimitDecision.allow(
                limit.limit(),
                (long) Math.floor(state.tokens()),
                resetAt(state, limit, nowMillis),
                limit.windowSeconds(),
                algorithm());
    }

    private Instant resetAt(BucketState state, EffectiveRateLimit limit, long nowMillis) {
        return Instant.ofEpochMilli(nowMillis + millisUntilFull(state, limit));
    }

    private long expiry(BucketState state, EffectiveRateLimit limit, long nowMillis) {
        return nowMillis + millisUntilFull(state, limit) + 1000;
    }

    private long millisUntilFull(BucketState state, EffectiveRateLimit limit) {
        if (limit.limit() == 0) {
            return 0;
        }
        final var missing = limit.limit() - state.tokens();
        return (long) Math.ceil(missing * limit.windowMillis() / limit.limit());
    }

    private long retryAfter(BucketState state, EffectiveRateLimit limit, long cost) {
        if (cost > limit.limit() || limit.limit() == 0) {
            return limit.windowSeconds();
        }
        final var rate = limit.refillRatePerSecond();
        return Math.max(1, (long) Math.ceil((cost - state.tokens()) / rate));
    }
}
