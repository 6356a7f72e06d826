package turnstile.core.model.ratelimit;

import java.util.List;

/**
 * Sliding log state: one entry per admitted request with its cost, oldest first.
 *
 * @param entries admitted requests, ascending by timestamp
 */
public record SlidingLogState(List<LogEntry> entries) implements RateLimitState {

    public SlidingLogState {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    /**
     * Sum of the costs currently in the log.
     *
     * @return the total cost
     */
    public long totalCost() {
        var total = 0L;
        for (var entry : entries) {
            total += entry.cost();
        }
        return total;
    }

    /**
     * A single admitted request.
     *
     * @param timestampMillis when it was admitted (epoch millis)
     * @param cost            its cost
     */
    public record LogEntry(long timestampMillis, long cost) {

        public LogEntry {
            if (cost <= 0) {
                throw new IllegalArgumentException("cost must be positive");
            }
        }
    }
}
