package turnstile.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Instant;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.core.model.activity.ActivityEvent;
import turnstile.core.model.activity.ActivityType;
import turnstile.core.model.activity.Severity;

@DisplayName("MetricsActivityEventHandler")
class MetricsActivityEventHandlerTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private SimpleMeterRegistry registry;
    private MetricsActivityEventHandler handler;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        handler = new MetricsActivityEventHandler(registry);
    }

    private static ActivityEvent.Builder event(ActivityType type, Severity severity) {
        return ActivityEvent.builder(type, severity).timestamp(NOW);
    }

    @Test
    @DisplayName("should count every event by type and severity")
    void shouldCountEvents() {
        handler.handle(event(ActivityType.AUTH_SUCCESS, Severity.LOW).build());
        handler.handle(event(ActivityType.AUTH_SUCCESS, Severity.LOW).build());

        var counter = registry.find("turnstile.activity.events")
                .tag("type", "auth_success")
                .tag("severity", "low")
                .counter();
        assertEquals(2.0, counter.count());
    }

    @Test
    @DisplayName("should count authentication failures by reason")
    void shouldCountAuthFailures() {
        handler.handle(event(ActivityType.AUTH_FAILED, Severity.MEDIUM)
                .detail("reason", "invalid_key")
                .build());
        handler.handle(event(ActivityType.IP_BLOCKED, Severity.HIGH).build());

        assertEquals(
                1.0,
                registry.find("turnstile.auth.failures").tag("reason", "invalid_key").counter().count());
        assertEquals(
                1.0, registry.find("turnstile.auth.failures").tag("reason", "unknown").counter().count());
    }

    @Test
    @DisplayName("should count rate limit rejections by layer")
    void shouldCountRateLimitRejections() {
        handler.handle(event(ActivityType.RATE_LIMIT_EXCEEDED, Severity.MEDIUM)
                .detail("layer", "endpoint")
                .build());

        assertEquals(
                1.0,
                registry.find("turnstile.rate_limit.exceeded").tag("layer", "endpoint").counter().count());
        assertNull(registry.find("turnstile.auth.failures").counter());
    }
}
