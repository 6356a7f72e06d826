package turnstile.core.model.auth;

import java.util.Locale;

/**
 * Persisted status of an API key.
 *
 * <p>Expiry is also time-derived: a key whose {@code expiresAt} has passed is
 * treated as expired even while its status is still {@link #ACTIVE}.
 */
public enum ApiKeyStatus {
    ACTIVE,
    SUSPENDED,
    REVOKED,
    EXPIRED;

    /**
     * Parse a status from its lowercase or uppercase name.
     *
     * @param value the status name (e.g. "active")
     * @return the status
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ApiKeyStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("API key status cannot be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
