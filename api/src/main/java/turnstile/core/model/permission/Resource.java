package turnstile.core.model.permission;

import java.util.Locale;

/**
 * Resource types that API key scopes protect.
 */
public enum Resource {
    USER,
    API_KEY,
    ANALYTICS,
    ADMIN,
    SYSTEM,
    BILLING,
    WEBHOOK,
    INTEGRATION;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a resource from its lowercase name.
     *
     * @param value e.g. "api_key"
     * @return the resource
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Resource fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Resource cannot be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
