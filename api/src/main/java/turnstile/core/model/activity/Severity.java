package turnstile.core.model.activity;

import java.util.Locale;

/**
 * Severity of an activity event.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * The next level up, saturating at {@link #CRITICAL}.
     *
     * @return the escalated severity
     */
    public Severity escalate() {
        return this == CRITICAL ? CRITICAL : values()[ordinal() + 1];
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
