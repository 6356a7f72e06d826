package turnstile.core.port.out;

import java.time.Duration;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.ratelimit.EffectiveRateLimit;
import turnstile.core.model.ratelimit.RateLimitAlgorithmHandler;
import turnstile.core.model.ratelimit.RateLimitDecision;

/**
 * Port interface for rate limit state storage.
 *
 * <p>Pure storage: policy lives in the algorithm handlers and the rate limit manager.
 * Every operation on a single key is atomic. Failures, including timeouts, are signalled
 * as {@link turnstile.core.model.ratelimit.RateLimitUnavailableException}.
 */
public interface RateLimitStore {

    /**
     * Returns the name of this store for logging.
     *
     * @return e.g. "memory" or "redis"
     */
    String name();

    /**
     * Run one algorithm check for a key as a single atomic step.
     *
     * @param handler the algorithm
     * @param key     the logical rate limit key
     * @param limit   the limit to apply
     * @param cost    the request cost, zero for a status peek
     * @return Uni with the decision
     */
    Uni<RateLimitDecision> evaluate(RateLimitAlgorithmHandler handler, String key, EffectiveRateLimit limit, long cost);

    /**
     * Atomically add {@code delta} to a counter and return the new value.
     *
     * <p>The TTL is applied when the counter is created; later increments keep it.
     *
     * @param key   counter key
     * @param delta amount to add
     * @param ttl   lifetime of a new counter
     * @return Uni with the new count
     */
    Uni<Long> increment(String key, long delta, Duration ttl);

    /**
     * Read a counter.
     *
     * @param key counter key
     * @return Uni with the count, zero when absent or expired
     */
    Uni<Long> get(String key);

    /**
     * Set the lifetime of an existing entry.
     *
     * @param key entry key
     * @param ttl new lifetime from now
     * @return Uni with true if the entry existed
     */
    Uni<Boolean> expire(String key, Duration ttl);

    /**
     * Remove a key and every key derived from it ({@code key:*}).
     *
     * @param key the logical key
     * @return Uni with true if anything was removed
     */
    Uni<Boolean> reset(String key);
}
