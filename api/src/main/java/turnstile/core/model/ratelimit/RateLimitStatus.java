package turnstile.core.model.ratelimit;

/**
 * Read-only view of a key's per-key rate limit usage.
 *
 * @param keyId    the API key id
 * @param period   the configured period
 * @param decision the peek decision (cost 0)
 */
public record RateLimitStatus(String keyId, RateLimitPeriod period, RateLimitDecision decision) {

    public boolean unlimited() {
        return decision.isUnlimited();
    }

    public long used() {
        return decision.used();
    }

    public long remaining() {
        return decision.remaining();
    }
}
