package turnstile.core.model.ratelimit;

import java.util.Locale;

/**
 * Period a per-key rate limit is expressed in.
 */
public enum RateLimitPeriod {
    MINUTE(60),
    HOUR(3_600),
    DAY(86_400),
    /** Thirty days. */
    MONTH(2_592_000);

    private final long windowSeconds;

    RateLimitPeriod(long windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public long windowSeconds() {
        return windowSeconds;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a period from {@code minute}, {@code requests_per_minute} and similar forms.
     *
     * @param value the period name
     * @return the period
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RateLimitPeriod fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rate limit period cannot be null or blank");
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("requests_per_")) {
            normalized = normalized.substring("requests_per_".length());
        }
        return valueOf(normalized.toUpperCase(Locale.ROOT));
    }
}
