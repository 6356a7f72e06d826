package turnstile.core.model.ratelimit;

/**
 * Output of an algorithm: the decision plus the state to store.
 *
 * @param decision        the admission decision
 * @param newState        state to persist; the same instance as the input means "unchanged",
 *                        null means "nothing to store"
 * @param expiresAtMillis when the stored state may be discarded (epoch millis)
 */
public record RateLimitEvaluation(RateLimitDecision decision, RateLimitState newState, long expiresAtMillis) {

    public RateLimitEvaluation {
        if (decision == null) {
            throw new IllegalArgumentException("decision cannot be null");
        }
    }
}
