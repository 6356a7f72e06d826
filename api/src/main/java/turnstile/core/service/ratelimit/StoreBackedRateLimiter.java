package turnstile.core.service.ratelimit;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.ratelimit.EffectiveRateLimit;
import turnstile.core.model.ratelimit.RateLimitAlgorithm;
import turnstile.core.model.ratelimit.RateLimitAlgorithmHandler;
import turnstile.core.model.ratelimit.RateLimitDecision;
import turnstile.core.port.out.RateLimitStore;

/**
 * {@link RateLimiter} that runs an algorithm handler inside a {@link RateLimitStore}.
 */
public final class StoreBackedRateLimiter implements RateLimiter {

    private final RateLimitAlgorithmHandler handler;
    private final RateLimitStore store;

    public StoreBackedRateLimiter(RateLimitAlgorithmHandler handler, RateLimitStore store) {
        this.handler = handler;
        this.store = store;
    }

    @Override
    public RateLimitAlgorithm algorithm() {
        return handler.algorithm();
    }

    @Override
    public Uni<RateLimitDecision> check(String key, EffectiveRateLimit limit, long cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be non-negative, got: " + cost);
        }
        return store.evaluate(handler, key, limit, cost);
    }

    @Override
    public Uni<Boolean> reset(String key) {
        return store.reset(key);
    }
}
