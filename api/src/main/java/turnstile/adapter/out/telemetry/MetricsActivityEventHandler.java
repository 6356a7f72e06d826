package turnstile.adapter.out.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import turnstile.core.model.activity.ActivityEvent;
import turnstile.core.model.activity.ActivityType;
import turnstile.spi.ActivityEventHandler;

/**
 * Activity event handler that records events as Micrometer metrics.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code turnstile.activity.events} - All events by type and severity</li>
 *   <li>{@code turnstile.auth.failures} - Authentication rejections by reason</li>
 *   <li>{@code turnstile.rate_limit.exceeded} - Rate limit rejections by layer</li>
 * </ul>
 */
public class MetricsActivityEventHandler implements ActivityEventHandler {

    private final MeterRegistry registry;

    public MetricsActivityEventHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public void handle(ActivityEvent event) {
        Counter.builder("turnstile.activity.events")
                .description("API key activity events")
                .tag("type", event.type().value())
                .tag("severity", event.severity().value())
                .register(registry)
                .increment();

        if (event.type() == ActivityType.AUTH_FAILED || event.type() == ActivityType.IP_BLOCKED) {
            Counter.builder("turnstile.auth.failures")
                    .description("Authentication rejections")
                    .tag("reason", detail(event, "reason"))
                    .register(registry)
                    .increment();
        } else if (event.type() == ActivityType.RATE_LIMIT_EXCEEDED) {
            Counter.builder("turnstile.rate_limit.exceeded")
                    .description("Rate limit rejections")
                    .tag("layer", detail(event, "layer"))
                    .register(registry)
                    .increment();
        }
    }

    private String detail(ActivityEvent event, String name) {
        final var value = event.details().get(name);
        return value != null ? value.toString() : "unknown";
    }
}
