package turnstile.core.model.ratelimit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Standard rate limit response headers for a decision.
 */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";
    public static final String WINDOW = "X-RateLimit-Window";
    public static final String ALGORITHM = "X-RateLimit-Algorithm";

    private static final String UNLIMITED = "unlimited";

    private RateLimitHeaders() {}

    /**
     * Render the headers for a decision.
     *
     * <p>{@code Retry-After} is only present on rejections. Unlimited decisions report
     * {@code unlimited} for limit and remaining and carry no window.
     *
     * @param decision the decision
     * @return header name to value, in a stable order
     */
    public static Map<String, String> from(RateLimitDecision decision) {
        final var headers = new LinkedHashMap<String, String>();
        if (decision.isUnlimited()) {
            headers.put(LIMIT, UNLIMITED);
            headers.put(REMAINING, UNLIMITED);
            headers.put(RESET, String.valueOf(decision.resetAtEpochSeconds()));
            headers.put(ALGORITHM, decision.algorithm());
            return Collections.unmodifiableMap(headers);
        }

        headers.put(LIMIT, String.valueOf(decision.limit()));
        headers.put(REMAINING, String.valueOf(decision.remaining()));
        headers.put(RESET, String.valueOf(decision.resetAtEpochSeconds()));
        if (!decision.allowed()) {
            decision.retryAfterSeconds().ifPresent(seconds -> headers.put(RETRY_AFTER, String.valueOf(seconds)));
        }
        headers.put(WINDOW, String.valueOf(decision.windowSeconds()));
        headers.put(ALGORITHM, decision.algorithm());
        return Collections.unmodifiableMap(headers);
    }
}
