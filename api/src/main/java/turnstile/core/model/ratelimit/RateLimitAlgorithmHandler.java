package turnstile.core.model.ratelimit;

/**
 * Admission logic for one rate limiting algorithm.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li>Stateless (state is passed in and returned)</li>
 *   <li>Deterministic given the same inputs</li>
 *   <li>Non-mutating for {@code cost == 0}: such a check never rejects and returns the input state</li>
 * </ul>
 *
 * <p>Atomicity is the store's job: it runs {@link #evaluate} for a key inside one atomic step.
 */
public interface RateLimitAlgorithmHandler {

    /**
     * Returns the algorithm type this handler implements.
     *
     * @return the algorithm type
     */
    RateLimitAlgorithm algorithm();

    /**
     * Key under which state is stored for a check at {@code nowMillis}.
     *
     * <p>Derived keys must start with {@code baseKey + ":"} so a reset of the base key
     * can find them.
     *
     * @param baseKey   the logical rate limit key
     * @param limit     the limit being applied
     * @param nowMillis current time
     * @return the storage key
     */
    default String storageKey(String baseKey, EffectiveRateLimit limit, long nowMillis) {
        return baseKey;
    }

    /**
     * Decide on a request of the given cost and compute the state to store.
     *
     * @param currentState the stored state (null when none exists)
     * @param limit        the limit to apply
     * @param cost         the request cost, zero for a status peek
     * @param nowMillis    current time in epoch millis
     * @return the decision and the new state
     */
    RateLimitEvaluation evaluate(RateLimitState currentState, EffectiveRateLimit limit, long cost, long nowMillis);

    /**
     * Seconds from {@code nowMillis} until {@code targetMillis}, rounded up, at least one.
     *
     * @param nowMillis    current time
     * @param targetMillis future time
     * @return whole seconds to wait
     */
    static long secondsUntil(long nowMillis, long targetMillis) {
        final var millis = Math.max(0, targetMillis - nowMillis);
        return Math.max(1, (millis + 999) / 1000);
    }
}
