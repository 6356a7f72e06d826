package turnstile.testing;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import turnstile.core.model.activity.ActivityEvent;
import turnstile.core.model.activity.ActivityType;
import turnstile.core.port.out.ActivityLog;

/**
 * Activity log that keeps every recorded event in memory.
 */
public final class RecordingActivityLog implements ActivityLog {

    private final List<ActivityEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(ActivityEvent event) {
        events.add(event);
    }

    public List<ActivityEvent> events() {
        return List.copyOf(events);
    }

    public List<ActivityEvent> ofType(ActivityType type) {
        return events.stream().filter(event -> event.type() == type).toList();
    }

    public ActivityEvent last() {
        if (events.isEmpty()) {
            throw new AssertionError("No activity events recorded");
        }
        return events.get(events.size() - 1);
    }

    public void clear() {
        events.clear();
    }
}
