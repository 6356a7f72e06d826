package turnstile.spi;

import turnstile.core.model.activity.ActivityEvent;
import turnstile.core.model.activity.Severity;

/**
 * Receives API key activity events in addition to the built-in log and metrics sinks.
 *
 * <p>Implementations are found with {@link java.util.ServiceLoader} through
 * {@code META-INF/services/turnstile.spi.ActivityEventHandler} and need a public no-arg
 * constructor. {@link #handle} runs on the calling thread while the request is being
 * admitted, so it must return quickly. A handler that throws is logged and skipped.
 */
public interface ActivityEventHandler {

    /**
     * Name used in log output.
     */
    String name();

    /**
     * Events below this severity are not passed to {@link #handle}.
     *
     * @return the lowest severity this handler receives (default: {@link Severity#LOW})
     */
    default Severity minimumSeverity() {
        return Severity.LOW;
    }

    void handle(ActivityEvent event);
}
