package turnstile.core.model.ratelimit;

import java.util.Locale;

/**
 * Supported rate limiting algorithms.
 */
public enum RateLimitAlgorithm {
    /** Counter per aligned window; cheap, allows bursts at window boundaries. */
    FIXED_WINDOW("fixed_window"),
    /** Timestamps of recent requests over a trailing window. */
    SLIDING_WINDOW("sliding_window"),
    /** Timestamped costs over a trailing window; supports variable request cost. */
    SLIDING_LOG("sliding_log"),
    /** Continuously refilling pool of tokens. */
    TOKEN_BUCKET("token_bucket");

    private final String wireName;

    RateLimitAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in headers and response bodies.
     *
     * @return the lowercase algorithm name
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Parse an algorithm from its wire name or enum name.
     *
     * @param name e.g. "sliding_window" or "SLIDING_WINDOW"
     * @return the algorithm
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RateLimitAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rate limit algorithm cannot be null or blank");
        }
        final var normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (var algorithm : values()) {
            if (algorithm.wireName.equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown rate limit algorithm: " + name);
    }
}
