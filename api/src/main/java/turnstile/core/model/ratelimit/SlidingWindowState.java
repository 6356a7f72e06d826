package turnstile.core.model.ratelimit;

import java.util.List;

/**
 * Sliding window state: one timestamp per admitted unit of cost, oldest first.
 *
 * @param timestamps admission timestamps in epoch millis, ascending
 */
public record SlidingWindowState(List<Long> timestamps) implements RateLimitState {

    public SlidingWindowState {
        timestamps = timestamps == null ? List.of() : List.copyOf(timestamps);
    }

    public int count() {
        return timestamps.size();
    }
}
