package turnstile.core.model.activity;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured activity event handed to the activity log.
 *
 * @param type       event type
 * @param severity   severity
 * @param keyId      API key id involved (may be null)
 * @param userId     owning user (may be null)
 * @param sourceIp   requester IP (may be null)
 * @param endpoint   request path (may be null)
 * @param statusCode HTTP status the caller answers with (0 when not request-bound)
 * @param details    additional attributes
 * @param timestamp  when the event occurred, read from the recording service's clock
 */
public record ActivityEvent(
        ActivityType type,
        Severity severity,
        String keyId,
        String userId,
        String sourceIp,
        String endpoint,
        int statusCode,
        Map<String, Object> details,
        Instant timestamp) {

    public ActivityEvent {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (severity == null) {
            severity = Severity.LOW;
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ActivityEvent withSeverity(Severity newSeverity) {
        return new ActivityEvent(type, newSeverity, keyId, userId, sourceIp, endpoint, statusCode, details, timestamp);
    }

    public ActivityEvent withDetail(String name, Object value) {
        final var merged = new LinkedHashMap<String, Object>(details);
        merged.put(name, value);
        return new ActivityEvent(type, severity, keyId, userId, sourceIp, endpoint, statusCode, merged, timestamp);
    }

    public static Builder builder(ActivityType type, Severity severity) {
        return new Builder(type, severity);
    }

    public static class Builder {
        private final ActivityType type;
        private final Severity severity;
        private String keyId;
        private String userId;
        private String sourceIp;
        private String endpoint;
        private int statusCode;
        private final Map<String, Object> details = new LinkedHashMap<>();
        private Instant timestamp;

        private Builder(ActivityType type, Severity severity) {
            this.type = type;
            this.severity = severity;
        }

        public Builder keyId(String keyId) {
            this.keyId = keyId;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        /**
         * Add a detail attribute; null values are skipped.
         */
        public Builder detail(String name, Object value) {
            if (value != null) {
                this.details.put(name, value);
            }
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public ActivityEvent build() {
            return new ActivityEvent(type, severity, keyId, userId, sourceIp, endpoint, statusCode, details, timestamp);
        }
    }
}
