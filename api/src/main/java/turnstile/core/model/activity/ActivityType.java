package turnstile.core.model.activity;

import java.util.Locale;

/**
 * Kinds of activity events emitted by the admission core.
 */
public enum ActivityType {
    AUTH_SUCCESS,
    AUTH_FAILED,
    IP_BLOCKED,
    PERMISSION_GRANTED,
    PERMISSION_DENIED,
    RATE_LIMIT_EXCEEDED,
    RATE_LIMIT_UNAVAILABLE,
    RATE_LIMIT_RESET,
    KEY_EXPIRED,
    KEY_ROTATED,
    KEY_REVOKED,
    KEY_EXPIRING;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
