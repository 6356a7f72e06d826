package turnstile.core.model.admission;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import turnstile.core.model.auth.AuthenticationOutcome;
import turnstile.core.model.permission.ResourcePermission;
import turnstile.core.model.ratelimit.RateLimitResult;

/**
 * Result of the admission pipeline for one request.
 *
 * @param stage          where the request stopped ({@link AdmissionStage#ADMITTED} when it passed)
 * @param statusCode     HTTP status the caller should answer with when not admitted (200 otherwise)
 * @param authentication the gate outcome
 * @param rateLimit      the rate limit result (null when authentication failed)
 * @param denied         the missing permission (null unless the permission stage rejected)
 */
public record AdmissionDecision(
        AdmissionStage stage,
        int statusCode,
        AuthenticationOutcome authentication,
        RateLimitResult rateLimit,
        ResourcePermission denied) {

    public static AdmissionDecision admitted(AuthenticationOutcome authentication, RateLimitResult rateLimit) {
        return new AdmissionDecision(AdmissionStage.ADMITTED, 200, authentication, rateLimit, null);
    }

    public static AdmissionDecision unauthenticated(AuthenticationOutcome.Rejected rejected) {
        return new AdmissionDecision(AdmissionStage.AUTHENTICATION, rejected.statusCode(), rejected, null, null);
    }

    public static AdmissionDecision rateLimited(AuthenticationOutcome authentication, RateLimitResult rateLimit) {
        final var status = rateLimit.unavailable() ? 503 : 429;
        return new AdmissionDecision(AdmissionStage.RATE_LIMIT, status, authentication, rateLimit, null);
    }

    public static AdmissionDecision forbidden(
            AuthenticationOutcome authentication, RateLimitResult rateLimit, ResourcePermission denied) {
        return new AdmissionDecision(AdmissionStage.PERMISSION, 403, authentication, rateLimit, denied);
    }

    public boolean admitted() {
        return stage == AdmissionStage.ADMITTED;
    }

    /**
     * Rate limit headers to attach to the response, admitted or not.
     *
     * @return the headers (empty when rate limiting never ran)
     */
    public Map<String, String> headers() {
        return rateLimit == null ? Map.of() : rateLimit.headers();
    }

    /**
     * JSON-ready error body for a rejected request.
     *
     * @return the body, empty when admitted
     */
    public Map<String, Object> errorBody() {
        switch (stage) {
            case AUTHENTICATION -> {
                final var rejected = (AuthenticationOutcome.Rejected) authentication;
                return body(rejected.reason().code(), rejected.reason().message());
            }
            case RATE_LIMIT -> {
                return rateLimit.errorBody();
            }
            case PERMISSION -> {
                return body("insufficient_permissions", "Missing required permission: " + denied);
            }
            default -> {
                return Map.of();
            }
        }
    }

    private static Map<String, Object> body(String error, String message) {
        final var body = new LinkedHashMap<String, Object>();
        body.put("error", error);
        body.put("message", message);
        return Collections.unmodifiableMap(body);
    }
}
