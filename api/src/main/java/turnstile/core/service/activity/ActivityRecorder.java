package turnstile.core.service.activity;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.ActivityConfig;
import turnstile.core.model.activity.ActivityEvent;
import turnstile.core.model.activity.ActivityType;
import turnstile.core.model.activity.Severity;
import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.auth.AuthenticationRequest;
import turnstile.core.model.auth.RejectionReason;
import turnstile.core.model.lifecycle.ExpirationNotice;
import turnstile.core.model.lifecycle.RotationResult;
import turnstile.core.model.permission.ResourcePermission;
import turnstile.core.model.ratelimit.RateLimitLayer;
import turnstile.core.model.ratelimit.RateLimitResult;
import turnstile.core.port.out.ActivityLog;
import turnstile.core.port.out.RateLimitStore;

/**
 * Builds activity events for the admission core and hands them to the {@link ActivityLog}.
 *
 * <p>Authentication failures are counted per source IP and rate limit rejections per key id.
 * Once a count reaches the configured threshold within the repeat window, the event is
 * escalated one severity level. The count is attached to the event either way.
 *
 * <p>Returned {@link Uni}s never fail: recording problems are logged and dropped.
 */
@ApplicationScoped
public class ActivityRecorder {

    private static final Logger LOG = Logger.getLogger(ActivityRecorder.class);

    static final String AUTH_FAILURE_COUNTER_PREFIX = "activity:auth_failures:";
    static final String RATE_LIMIT_COUNTER_PREFIX = "activity:rate_limit_rejections:";
    static final String RECENT_FAILURES = "recent_failures";
    static final String RECENT_REJECTIONS = "recent_rejections";
    private static final String UNKNOWN_SOURCE = "unknown";

    private final ActivityLog activityLog;
    private final RateLimitStore counterStore;
    private final ActivityConfig config;
    private final Clock clock;

    @Inject
    public ActivityRecorder(ActivityLog activityLog, RateLimitStore counterStore, ActivityConfig config, Clock clock) {
        this.activityLog = activityLog;
        this.counterStore = counterStore;
        this.config = config;
        this.clock = clock;
    }

    public Uni<Void> authenticationSucceeded(ApiKeyRecord apiKey, AuthenticationRequest request, boolean deprecated) {
        final var event = ActivityEvent.builder(ActivityType.AUTH_SUCCESS, Severity.LOW)
                .keyId(apiKey.keyId())
                .userId(apiKey.userId())
                .sourceIp(request.sourceIp())
                .endpoint(request.requestPath())
                .statusCode(200)
                .detail("deprecated", deprecated)
                .timestamp(clock.instant())
                .build();
        emit(event);
        return Uni.createFrom().voidItem();
    }

    /**
     * Record a rejected authentication attempt.
     *
     * @param request the request
     * @param reason  why it was rejected
     * @param keyId   the presented key id, if one could be parsed
     * @param apiKey  the matched record, if any
     * @return Uni completing once the event is handed off
     */
    public Uni<Void> authenticationFailed(
            AuthenticationRequest request, RejectionReason reason, String keyId, ApiKeyRecord apiKey) {
        final var blocked = reason == RejectionReason.IP_REJECTED || reason == RejectionReason.DOMAIN_REJECTED;
        final var event = ActivityEvent.builder(
                        blocked ? ActivityType.IP_BLOCKED : ActivityType.AUTH_FAILED,
                        blocked ? Severity.HIGH : Severity.MEDIUM)
                .keyId(keyId)
                .userId(apiKey != null ? apiKey.userId() : null)
                .sourceIp(request.sourceIp())
                .endpoint(request.requestPath())
                .statusCode(reason.statusCode())
                .detail("reason", reason.code())
                .detail("origin", request.originHost())
                .timestamp(clock.instant())
                .build();
        final var source = request.sourceIp() != null ? request.sourceIp() : UNKNOWN_SOURCE;
        return escalateOnRepeat(event, AUTH_FAILURE_COUNTER_PREFIX + source, RECENT_FAILURES)
                .invoke(this::emit)
                .replaceWithVoid();
    }

    public Uni<Void> rateLimitExceeded(ApiKeyRecord apiKey, String sourceIp, String path, RateLimitResult result) {
        final var decision = result.decision();
        final var builder = ActivityEvent.builder(ActivityType.RATE_LIMIT_EXCEEDED, Severity.MEDIUM)
                .keyId(apiKey.keyId())
                .userId(apiKey.userId())
                .sourceIp(sourceIp)
                .endpoint(path)
                .statusCode(429)
                .detail("layer", result.rejectedBy().map(RateLimitLayer::wireName).orElse(null))
                .timestamp(clock.instant());
        if (decision != null) {
            builder.detail("limit", decision.limit())
                    .detail("algorithm", decision.algorithm())
                    .detail("retry_after", decision.retryAfterSeconds().orElse(0));
        }
        return escalateOnRepeat(builder.build(), RATE_LIMIT_COUNTER_PREFIX + apiKey.keyId(), RECENT_REJECTIONS)
                .invoke(this::emit)
                .replaceWithVoid();
    }

    public Uni<Void> rateLimitUnavailable(ApiKeyRecord apiKey, String path, boolean allowed) {
        emit(ActivityEvent.builder(ActivityType.RATE_LIMIT_UNAVAILABLE, Severity.HIGH)
                .keyId(apiKey.keyId())
                .userId(apiKey.userId())
                .endpoint(path)
                .statusCode(allowed ? 200 : 503)
                .detail("allowed", allowed)
                .timestamp(clock.instant())
                .build());
        return Uni.createFrom().voidItem();
    }

    public void rateLimitReset(String keyId, boolean cleared) {
        emit(ActivityEvent.builder(ActivityType.RATE_LIMIT_RESET, Severity.LOW)
                .keyId(keyId)
                .detail("cleared", cleared)
                .timestamp(clock.instant())
                .build());
    }

    public void permissionChecked(ApiKeyRecord apiKey, String path, ResourcePermission required, boolean granted) {
        emit(ActivityEvent.builder(
                        granted ? ActivityType.PERMISSION_GRANTED : ActivityType.PERMISSION_DENIED,
                        granted ? Severity.LOW : Severity.MEDIUM)
                .keyId(apiKey.keyId())
                .userId(apiKey.userId())
                .endpoint(path)
                .statusCode(granted ? 200 : 403)
                .detail("required_permission", required.toString())
                .timestamp(clock.instant())
                .build());
    }

    public void keyExpired(ApiKeyRecord apiKey) {
        emit(ActivityEvent.builder(ActivityType.KEY_EXPIRED, Severity.MEDIUM)
                .keyId(apiKey.keyId())
                .userId(apiKey.userId())
                .detail("expired_at", apiKey.expiresAt() != null ? apiKey.expiresAt().toString() : null)
                .timestamp(clock.instant())
                .build());
    }

    public void keyExpiring(ExpirationNotice notice) {
        emit(ActivityEvent.builder(ActivityType.KEY_EXPIRING, Severity.LOW)
                .keyId(notice.keyId())
                .userId(notice.userId())
                .detail("days_until_expiry", notice.daysUntilExpiry())
                .detail("level", notice.level().value())
                .timestamp(clock.instant())
                .build());
    }

    /**
     * Record a completed rotation. Immediate rotations also produce a revocation event.
     *
     * @param oldKey the key that was replaced
     * @param result the rotation result
     */
    public void keyRotated(ApiKeyRecord oldKey, RotationResult result) {
        emit(ActivityEvent.builder(ActivityType.KEY_ROTATED, Severity.MEDIUM)
                .keyId(oldKey.keyId())
                .userId(oldKey.userId())
                .detail("new_key_id", result.newKeyId())
                .detail("trigger", result.trigger().value())
                .detail("transition_days", result.transitionDays())
                .timestamp(clock.instant())
                .build());
        if (result.trigger().immediate()) {
            emit(ActivityEvent.builder(ActivityType.KEY_REVOKED, Severity.HIGH)
                    .keyId(oldKey.keyId())
                    .userId(oldKey.userId())
                    .detail("trigger", result.trigger().value())
                    .timestamp(clock.instant())
                    .build());
        }
    }

    private Uni<ActivityEvent> escalateOnRepeat(ActivityEvent event, String counterKey, String detailName) {
        if (!config.enabled()) {
            return Uni.createFrom().item(event);
        }
        return counterStore
                .increment(counterKey, 1, config.repeatWindow())
                .map(count -> {
                    final var counted = event.withDetail(detailName, count);
                    return count >= config.repeatThreshold()
                            ? counted.withSeverity(event.severity().escalate())
                            : counted;
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Could not count repeated {0} events: {1}", event.type().value(), error.getMessage());
                    return event;
                });
    }

    private void emit(ActivityEvent event) {
        if (!config.enabled()) {
            return;
        }
        try {
            activityLog.record(event);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to record activity event: {0}", event.type().value());
        }
    }
}
