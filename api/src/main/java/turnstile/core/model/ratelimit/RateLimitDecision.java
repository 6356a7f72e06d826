package turnstile.core.model.ratelimit;

import java.time.Instant;
import java.util.OptionalLong;

/**
 * Result of a single rate limit check.
 *
 * <p>Ephemeral: only the store-side state change of a check persists.
 *
 * @param allowed            whether the request is admitted
 * @param limit              the limit applied
 * @param remaining          cost still admissible in the window, never negative
 * @param resetAt            when the window resets (fixed window) or frees up (sliding, bucket)
 * @param retryAfterSeconds  seconds until a retry can succeed, present only on rejection
 * @param windowSeconds      the window length
 * @param algorithm          wire name of the algorithm, or {@code none} for unlimited keys
 */
public record RateLimitDecision(
        boolean allowed,
        long limit,
        long remaining,
        Instant resetAt,
        OptionalLong retryAfterSeconds,
        long windowSeconds,
        String algorithm) {

    public static final String UNLIMITED_ALGORITHM = "none";

    public RateLimitDecision {
        remaining = Math.max(0, remaining);
        if (retryAfterSeconds == null) {
            retryAfterSeconds = OptionalLong.empty();
        }
        if (resetAt == null) {
            throw new IllegalArgumentException("resetAt cannot be null");
        }
    }

    public static RateLimitDecision allow(
            long limit, long remaining, Instant resetAt, long windowSeconds, RateLimitAlgorithm algorithm) {
        return new RateLimitDecision(
                true, limit, remaining, resetAt, OptionalLong.empty(), windowSeconds, algorithm.wireName());
    }

    public static RateLimitDecision rejected(
            long limit,
            long remaining,
            Instant resetAt,
            long retryAfterSeconds,
            long windowSeconds,
            RateLimitAlgorithm algorithm) {
        return new RateLimitDecision(
                false,
                limit,
                remaining,
                resetAt,
                OptionalLong.of(Math.max(1, retryAfterSeconds)),
                windowSeconds,
                algorithm.wireName());
    }

    /**
     * Decision for a key without a configured limit.
     *
     * @param now the current time
     * @return an allowed decision reported as unlimited
     */
    public static RateLimitDecision unlimited(Instant now) {
        return new RateLimitDecision(
                true, Long.MAX_VALUE, Long.MAX_VALUE, now, OptionalLong.empty(), 0, UNLIMITED_ALGORITHM);
    }

    public boolean isUnlimited() {
        return UNLIMITED_ALGORITHM.equals(algorithm);
    }

    /**
     * Cost consumed in the current window.
     *
     * @return {@code limit - remaining}, or 0 for unlimited decisions
     */
    public long used() {
        return isUnlimited() ? 0 : Math.max(0, limit - remaining);
    }

    public long resetAtEpochSeconds() {
        return resetAt.getEpochSecond();
    }
}
