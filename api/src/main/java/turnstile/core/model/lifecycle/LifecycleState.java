package turnstile.core.model.lifecycle;

import java.util.Locale;

/**
 * Lifecycle position of a key, derived from status and expiry.
 */
public enum LifecycleState {
    ACTIVE,
    EXPIRING_SOON,
    EXPIRED,
    DEPRECATED,
    REVOKED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
