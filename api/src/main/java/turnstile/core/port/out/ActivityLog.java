package turnstile.core.port.out;

import turnstile.core.model.activity.ActivityEvent;

/**
 * Write-only sink for activity events.
 *
 * <p>Fire-and-forget: implementations must not block the caller on delivery.
 */
public interface ActivityLog {

    void record(ActivityEvent event);
}
