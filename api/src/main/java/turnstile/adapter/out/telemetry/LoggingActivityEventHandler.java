package turnstile.adapter.out.telemetry;

import java.util.Locale;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import turnstile.core.model.activity.ActivityEvent;
import turnstile.spi.ActivityEventHandler;

/**
 * Activity event handler that logs events using JBoss Logging.
 *
 * <p>Log levels follow event severity:
 * <ul>
 *   <li>LOW severity -> DEBUG level</li>
 *   <li>MEDIUM severity -> INFO level</li>
 *   <li>HIGH severity -> WARN level</li>
 *   <li>CRITICAL severity -> ERROR level</li>
 * </ul>
 */
public class LoggingActivityEventHandler implements ActivityEventHandler {

    private static final Logger LOG = Logger.getLogger("turnstile.activity");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public void handle(ActivityEvent event) {
        final var message = formatEvent(event);

        switch (event.severity()) {
            case LOW -> LOG.debug(message);
            case MEDIUM -> LOG.info(message);
            case HIGH -> LOG.warn(message);
            case CRITICAL -> LOG.error(message);
        }
    }

    static String formatEvent(ActivityEvent event) {
        final var details = event.details().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(" "));
        final var message = String.format(
                "%s: key=%s user=%s ip=%s endpoint=%s status=%d",
                event.type().value().toUpperCase(Locale.ROOT),
                nullSafe(event.keyId()),
                nullSafe(event.userId()),
                nullSafe(event.sourceIp()),
                nullSafe(event.endpoint()),
                event.statusCode());
        return details.isEmpty() ? message : message + " " + details;
    }

    private static String nullSafe(String value) {
        return value != null ? value : "-";
    }
}
