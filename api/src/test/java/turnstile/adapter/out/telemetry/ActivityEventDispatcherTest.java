package turnstile.adapter.out.telemetry;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turnstile.core.config.ActivityConfig;
import turnstile.core.model.activity.ActivityEvent;
import turnstile.core.model.activity.ActivityType;
import turnstile.core.model.activity.Severity;
import turnstile.spi.ActivityEventHandler;
import turnstile.testing.CollectingActivityEventHandler;

@DisplayName("ActivityEventDispatcher")
class ActivityEventDispatcherTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private List<String> received;

    @BeforeEach
    void setUp() {
        received = new ArrayList<>();
        CollectingActivityEventHandler.clear();
    }

    private static ActivityEvent event(ActivityType type, Severity severity) {
        return ActivityEvent.builder(type, severity).keyId("ak_test").timestamp(NOW).build();
    }

    private ActivityEventHandler recording(String name, Severity minimum) {
        return new ActivityEventHandler() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Severity minimumSeverity() {
                return minimum;
            }

            @Override
            public void handle(ActivityEvent event) {
                received.add(name + ":" + event.type().value());
            }
        };
    }

    @Nested
    @DisplayName("record()")
    class RecordTests {

        @Test
        @DisplayName("should deliver to built-in handlers before extensions, on the calling thread")
        void shouldDeliverInOrder() {
            var dispatcher = new ActivityEventDispatcher(
                    true,
                    List.of(recording("metrics", Severity.LOW)),
                    List.of(recording("audit", Severity.LOW)));

            dispatcher.record(event(ActivityType.AUTH_FAILED, Severity.MEDIUM));
            dispatcher.record(event(ActivityType.KEY_ROTATED, Severity.MEDIUM));

            assertEquals(
                    List.of("metrics:auth_failed", "audit:auth_failed", "metrics:key_rotated", "audit:key_rotated"),
                    received);
        }

        @Test
        @DisplayName("should skip handlers whose minimum severity is above the event's")
        void shouldFilterBySeverity() {
            var dispatcher = new ActivityEventDispatcher(
                    true, List.of(recording("all", Severity.LOW)), List.of(recording("alerts", Severity.HIGH)));

            dispatcher.record(event(ActivityType.AUTH_SUCCESS, Severity.LOW));
            dispatcher.record(event(ActivityType.IP_BLOCKED, Severity.HIGH));

            assertEquals(List.of("all:auth_success", "all:ip_blocked", "alerts:ip_blocked"), received);
        }

        @Test
        @DisplayName("should keep delivering when a handler throws")
        void shouldIsolateHandlerFailures() {
            ActivityEventHandler failing = new ActivityEventHandler() {
                @Override
                public String name() {
                    return "failing";
                }

                @Override
                public void handle(ActivityEvent event) {
                    throw new IllegalStateException("sink unavailable");
                }
            };
            var dispatcher =
                    new ActivityEventDispatcher(true, List.of(failing), List.of(recording("ok", Severity.LOW)));

            assertDoesNotThrow(() -> dispatcher.record(event(ActivityType.IP_BLOCKED, Severity.HIGH)));
            assertEquals(List.of("ok:ip_blocked"), received);
        }

        @Test
        @DisplayName("should drop events when disabled")
        void shouldDropWhenDisabled() {
            var dispatcher =
                    new ActivityEventDispatcher(false, List.of(recording("metrics", Severity.LOW)), List.of());

            dispatcher.record(event(ActivityType.AUTH_FAILED, Severity.MEDIUM));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("handler discovery")
    class DiscoveryTests {

        @Test
        @DisplayName("should find handlers registered in META-INF/services")
        void shouldDiscoverRegisteredHandlers() {
            var names = ActivityEventDispatcher.discoverExtensions().stream()
                    .map(ActivityEventHandler::name)
                    .toList();

            assertEquals(List.of("collecting"), names);
        }

        @Test
        @DisplayName("should install metrics and logging ahead of discovered handlers")
        void shouldInstallBuiltInsFirst() {
            var config = mock(ActivityConfig.class);
            when(config.enabled()).thenReturn(true);
            var registry = new SimpleMeterRegistry();

            var dispatcher = new ActivityEventDispatcher(config, registry);

            var handlers = dispatcher.handlers();
            assertEquals(3, handlers.size());
            assertInstanceOf(MetricsActivityEventHandler.class, handlers.get(0));
            assertInstanceOf(LoggingActivityEventHandler.class, handlers.get(1));
            assertInstanceOf(CollectingActivityEventHandler.class, handlers.get(2));

            dispatcher.record(event(ActivityType.AUTH_SUCCESS, Severity.LOW));
            dispatcher.record(event(ActivityType.RATE_LIMIT_EXCEEDED, Severity.MEDIUM));

            assertEquals(2.0, registry.find("turnstile.activity.events").counters().stream()
                    .mapToDouble(counter -> counter.count())
                    .sum());
            assertEquals(
                    List.of(ActivityType.RATE_LIMIT_EXCEEDED),
                    CollectingActivityEventHandler.events().stream().map(ActivityEvent::type).toList());
        }
    }
}
