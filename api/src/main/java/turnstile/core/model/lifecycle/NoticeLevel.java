package turnstile.core.model.lifecycle;

import java.util.Locale;

/**
 * Urgency of an expiration notice.
 */
public enum NoticeLevel {
    WARNING,
    URGENT,
    CRITICAL,
    EXPIRED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
