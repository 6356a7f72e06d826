package turnstile.adapter.out.telemetry;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import turnstile.core.config.ActivityConfig;
import turnstile.core.model.activity.ActivityEvent;
import turnstile.core.port.out.ActivityLog;
import turnstile.spi.ActivityEventHandler;

/**
 * {@link ActivityLog} that fans each event out to the metrics and log sinks, then to any
 * {@link ActivityEventHandler} registered through {@link ServiceLoader}.
 *
 * <p>Recording is synchronous. A failing handler does not affect the others or the caller.
 */
@ApplicationScoped
public class ActivityEventDispatcher implements ActivityLog {

    private static final Logger LOG = Logger.getLogger(ActivityEventDispatcher.class);

    private final boolean enabled;
    private final List<ActivityEventHandler> handlers;

    @Inject
    public ActivityEventDispatcher(ActivityConfig config, MeterRegistry meterRegistry) {
        this(
                config.enabled(),
                List.of(new MetricsActivityEventHandler(meterRegistry), new LoggingActivityEventHandler()),
                discoverExtensions());
    }

    ActivityEventDispatcher(
            boolean enabled, List<ActivityEventHandler> builtIns, List<ActivityEventHandler> extensions) {
        this.enabled = enabled;
        final var all = new ArrayList<ActivityEventHandler>(builtIns.size() + extensions.size());
        all.addAll(builtIns);
        all.addAll(extensions);
        this.handlers = List.copyOf(all);

        if (!enabled) {
            LOG.info("Activity recording is disabled");
        } else if (!extensions.isEmpty()) {
            LOG.infov(
                    "Activity handlers: {0}",
                    handlers.stream().map(ActivityEventHandler::name).toList());
        }
    }

    static List<ActivityEventHandler> discoverExtensions() {
        return ServiceLoader.load(ActivityEventHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
    }

    @Override
    public void record(ActivityEvent event) {
        if (!enabled) {
            return;
        }
        for (final var handler : handlers) {
            if (!event.severity().isAtLeast(handler.minimumSeverity())) {
                continue;
            }
            try {
                handler.handle(event);
            } catch (RuntimeException e) {
                LOG.warnv(e, "Activity handler {0} failed on {1} event", handler.name(), event.type().value());
            }
        }
    }

    List<ActivityEventHandler> handlers() {
        return handlers;
    }
}
