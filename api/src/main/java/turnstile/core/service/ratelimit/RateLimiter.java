package turnstile.core.service.ratelimit;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.ratelimit.EffectiveRateLimit;
import turnstile.core.model.ratelimit.RateLimitAlgorithm;
import turnstile.core.model.ratelimit.RateLimitDecision;

/**
 * An algorithm bound to a store, selected once at configuration time.
 */
public interface RateLimiter {

    RateLimitAlgorithm algorithm();

    /**
     * Check a request of the given cost against a key.
     *
     * @param key   the logical rate limit key
     * @param limit the limit to apply
     * @param cost  the request cost, zero for a status peek
     * @return Uni with the decision
     */
    Uni<RateLimitDecision> check(String key, EffectiveRateLimit limit, long cost);

    /**
     * Clear all state recorded for a key.
     *
     * @param key the logical rate limit key
     * @return Uni with true if there was state to clear
     */
    Uni<Boolean> reset(String key);
}
