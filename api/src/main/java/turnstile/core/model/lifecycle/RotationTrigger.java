package turnstile.core.model.lifecycle;

import java.util.Locale;

/**
 * What caused a key rotation.
 */
public enum RotationTrigger {
    MANUAL(false),
    SCHEDULED(false),
    /** Revokes the old key immediately, without a transition period. */
    SECURITY_INCIDENT(true),
    USAGE_ANOMALY(false),
    EXPIRATION_APPROACHING(false),
    COMPLIANCE_REQUIREMENT(false);

    private final boolean immediate;

    RotationTrigger(boolean immediate) {
        this.immediate = immediate;
    }

    /**
     * Whether the old key is revoked at once instead of entering a transition period.
     *
     * @return true for immediate revocation
     */
    public boolean immediate() {
        return immediate;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a trigger from its lowercase name.
     *
     * @param value e.g. "security_incident"
     * @return the trigger
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RotationTrigger fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Rotation trigger cannot be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
