package turnstile.core.service.lifecycle;

import java.time.Duration;

/**
 * A lifecycle pass did not complete within the configured bound.
 */
public class LifecycleCycleTimeoutException extends RuntimeException {

    public LifecycleCycleTimeoutException(Duration timeout) {
        super("Lifecycle pass did not complete within " + timeout);
    }
}
