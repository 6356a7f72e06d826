package turnstile.core.model.ratelimit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Combined result of the per-key, global and endpoint layers for one request.
 *
 * @param allowed     whether every layer admitted the request
 * @param decision    the rejecting layer's decision, or the per-key decision when admitted;
 *                    null only when the store was unavailable and no local fallback answered
 * @param rejectedBy  the layer that rejected, if any
 * @param unavailable true when the store could not answer and the failure policy decided
 */
public record RateLimitResult(
        boolean allowed, RateLimitDecision decision, Optional<RateLimitLayer> rejectedBy, boolean unavailable) {

    public static final String UNAVAILABLE_ERROR = "rate_limiting_unavailable";

    public RateLimitResult {
        if (rejectedBy == null) {
            rejectedBy = Optional.empty();
        }
        if (decision == null && !unavailable) {
            throw new IllegalArgumentException("decision is required unless the store was unavailable");
        }
    }

    public static RateLimitResult admitted(RateLimitDecision decision) {
        return new RateLimitResult(true, decision, Optional.empty(), false);
    }

    public static RateLimitResult rejected(RateLimitLayer layer, RateLimitDecision decision) {
        return new RateLimitResult(false, decision, Optional.of(layer), false);
    }

    /**
     * Result decided by the failure policy because the store could not answer.
     *
     * @param allowed whether the policy admits the request
     * @return the result
     */
    public static RateLimitResult unavailable(boolean allowed) {
        return new RateLimitResult(allowed, null, Optional.empty(), true);
    }

    /**
     * Response headers for this result.
     *
     * @return headers mirroring the deciding layer, empty when no decision exists
     */
    public Map<String, String> headers() {
        return decision == null ? Map.of() : RateLimitHeaders.from(decision);
    }

    /**
     * JSON-ready body for a 429 (or 503 when unavailable) response.
     *
     * @return {@code error}, {@code message} and {@code details}
     */
    public Map<String, Object> errorBody() {
        final var body = new LinkedHashMap<String, Object>();
        if (decision == null) {
            body.put("error", UNAVAILABLE_ERROR);
            body.put("message", "Rate limiting is temporarily unavailable");
            body.put("details", Map.of());
            return Collections.unmodifiableMap(body);
        }

        body.put("error", rejectedBy.map(RateLimitLayer::errorType).orElse(RateLimitLayer.PER_KEY.errorType()));
        body.put("message", "Rate limit exceeded");

        final var details = new LinkedHashMap<String, Object>();
        details.put("limit", decision.limit());
        details.put("remaining", decision.remaining());
        details.put("reset_time", decision.resetAt().toString());
        details.put("retry_after", decision.retryAfterSeconds().isPresent()
                ? decision.retryAfterSeconds().getAsLong()
                : null);
        details.put("algorithm", decision.algorithm());
        details.put("window_size", decision.windowSeconds());
        rejectedBy.ifPresent(layer -> details.put("layer", layer.wireName()));
        body.put("details", Collections.unmodifiableMap(details));
        return Collections.unmodifiableMap(body);
    }
}
