package turnstile.core.service.lifecycle;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.ApiKeyConfig;
import turnstile.core.config.LifecycleConfig;
import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.auth.ApiKeyStatus;
import turnstile.core.model.lifecycle.ExpirationNotice;
import turnstile.core.model.lifecycle.LifecycleCycleResult;
import turnstile.core.model.lifecycle.LifecycleReport;
import turnstile.core.model.lifecycle.LifecycleState;
import turnstile.core.model.lifecycle.NoticeLevel;
import turnstile.core.model.lifecycle.RotationResult;
import turnstile.core.model.lifecycle.RotationTrigger;
import turnstile.core.model.permission.ScopeCatalog;
import turnstile.core.port.in.KeyLifecycleManagement;
import turnstile.core.port.out.ApiKeyRepository;
import turnstile.core.port.out.LifecycleNotifier;
import turnstile.core.service.activity.ActivityRecorder;
import turnstile.core.service.auth.KeyMaterialService;

/**
 * Expires, rotates and reports on API keys outside the request path.
 *
 * <h2>Rotation</h2>
 * <ol>
 *   <li>Generate new key material</li>
 *   <li>Create the replacement with the old key's scopes, allowlists and limits</li>
 *   <li>Suspend the old key until the end of the transition period, or revoke it
 *       immediately for security incidents</li>
 *   <li>Persist both records in one step and notify the owner</li>
 * </ol>
 *
 * <p>Rotation never fails its {@link Uni}: problems are reported in the {@link RotationResult}.
 */
@ApplicationScoped
public class KeyLifecycleService implements KeyLifecycleManagement {

    private static final Logger LOG = Logger.getLogger(KeyLifecycleService.class);

    static final String META_REPLACES = "replaces";
    static final String META_DEPRECATED_BY = "deprecated_by";
    static final String META_ROTATION_TRIGGER = "rotation_trigger";
    static final String META_ROTATION_TIMESTAMP = "rotation_timestamp";
    static final String META_TRANSITION_DAYS = "transition_days";

    private static final long SECONDS_PER_DAY = 86_400;
    private static final int EXPIRING_SOON_DAYS = 7;
    private static final DateTimeFormatter ROTATED_NAME_DATE =
            DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final ApiKeyRepository repository;
    private final KeyMaterialService keyMaterial;
    private final LifecycleNotifier notifier;
    private final ActivityRecorder activity;
    private final LifecycleConfig config;
    private final ApiKeyConfig apiKeyConfig;
    private final Clock clock;

    @Inject
    public KeyLifecycleService(
            ApiKeyRepository repository,
            KeyMaterialService keyMaterial,
            LifecycleNotifier notifier,
            ActivityRecorder activity,
            LifecycleConfig config,
            ApiKeyConfig apiKeyConfig,
            Clock clock) {
        this.repository = repository;
        this.keyMaterial = keyMaterial;
        this.notifier = notifier;
        this.activity = activity;
        this.config = config;
        this.apiKeyConfig = apiKeyConfig;
        this.clock = clock;
    }

    /**
     * Flip active keys past their expiry, and transition keys past their grace period,
     * to expired.
     */
    @Override
    public Uni<List<String>> expireOldKeys() {
        final var now = clock.instant();
        return Uni.combine()
                .all()
                .unis(repository.findByStatus(ApiKeyStatus.ACTIVE), repository.findByStatus(ApiKeyStatus.SUSPENDED))
                .asTuple()
                .flatMap(keys -> {
                    final var due = new ArrayList<ApiKeyRecord>();
                    keys.getItem1().stream().filter(key -> key.isExpiredAt(now)).forEach(due::add);
                    keys.getItem2().stream().filter(key -> key.isExpiredAt(now)).forEach(due::add);
                    return Multi.createFrom()
                            .iterable(due)
                            .onItem()
                            .transformToUniAndConcatenate(this::expire)
                            .filter(id -> id != null)
                            .collect()
                            .asList();
                })
                .invoke(expired -> {
                    if (!expired.isEmpty()) {
                        LOG.infov("Expired {0} API key(s)", expired.size());
                    }
                });
    }

    @Override
    public Uni<List<ExpirationNotice>> checkExpiringKeys() {
        final var now = clock.instant();
        final var cutoff = now.plus(config.notificationWindow());
        return repository.findByStatus(ApiKeyStatus.ACTIVE).map(keys -> {
            final var notices = new ArrayList<ExpirationNotice>();
            for (final var key : keys) {
                if (key.expiresAt() == null || key.expiresAt().isAfter(cutoff)) {
                    continue;
                }
                final var notice = notice(key, now);
                if (notice.daysUntilExpiry() > config.warningDays()) {
                    continue;
                }
                notices.add(notice);
                notifyExpiring(notice);
            }
            LOG.debugv("Found {0} expiring API key(s)", notices.size());
            return notices;
        });
    }

    @Override
    public Uni<RotationResult> rotate(String apiKeyId, RotationTrigger trigger) {
        return rotate(apiKeyId, trigger, null);
    }

    @Override
    public Uni<RotationResult> rotate(String apiKeyId, RotationTrigger trigger, Duration transitionPeriod) {
        final var now = clock.instant();
        if (transitionPeriod != null && transitionPeriod.isNegative()) {
            return Uni.createFrom()
                    .item(RotationResult.failed(
                            apiKeyId,
                            trigger,
                            now,
                            "Invalid transition period",
                            List.of("Transition period must not be negative: " + transitionPeriod)));
        }
        final var transition = trigger.immediate()
                ? Duration.ZERO
                : transitionPeriod != null ? transitionPeriod : config.transition().forTrigger(trigger);

        return repository
                .findById(apiKeyId)
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Uni.createFrom()
                                .item(RotationResult.failed(
                                        apiKeyId,
                                        trigger,
                                        now,
                                        "API key not found",
                                        List.of("API key not found: " + apiKeyId)));
                    }
                    return rotateExisting(found.get(), trigger, transition, now);
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.errorv(error, "Failed to rotate API key {0}", apiKeyId);
                    return RotationResult.failed(
                            apiKeyId, trigger, now, "Rotation failed: " + error.getMessage(), List.of(describe(error)));
                });
    }

    @Override
    public Uni<Boolean> scheduleAutoRotation(String apiKeyId, Duration interval) {
        final var effectiveInterval = interval != null ? interval : config.defaultRotationInterval();
        if (effectiveInterval.isZero() || effectiveInterval.isNegative()) {
            throw new IllegalArgumentException("Rotation interval must be positive");
        }
        final var now = clock.instant();
        return repository.findById(apiKeyId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            final var scheduled = found.get().toBuilder()
                    .rotationInterval(effectiveInterval)
                    .nextRotationAt(now.plus(effectiveInterval))
                    .build();
            return repository
                    .save(scheduled)
                    .invoke(() -> LOG.infov(
                            "Scheduled auto-rotation for API key {0} every {1} day(s)",
                            scheduled.keyId(), effectiveInterval.toDays()))
                    .replaceWith(true);
        });
    }

    /**
     * Rotate every active key whose scheduled rotation is due.
     *
     * <p>The replacement inherits the schedule, so the next rotation is one interval away.
     */
    @Override
    public Uni<List<RotationResult>> processScheduledRotations() {
        final var now = clock.instant();
        return repository
                .findByStatus(ApiKeyStatus.ACTIVE)
                .map(keys -> keys.stream()
                        .filter(key -> key.nextRotationAt() != null && !now.isBefore(key.nextRotationAt()))
                        .toList())
                .flatMap(due -> Multi.createFrom()
                        .iterable(due)
                        .onItem()
                        .transformToUniAndConcatenate(key -> rotate(key.id(), RotationTrigger.SCHEDULED))
                        .collect()
                        .asList())
                .invoke(results -> {
                    if (!results.isEmpty()) {
                        LOG.infov("Processed {0} scheduled rotation(s)", results.size());
                    }
                });
    }

    @Override
    public Uni<LifecycleReport> lifecycleStatus(String apiKeyId) {
        return repository.findById(apiKeyId).map(found -> {
            final var key = found.orElseThrow(() -> new IllegalArgumentException("API key not found: " + apiKeyId));
            final var now = clock.instant();
            final var state = lifecycleState(key, now);
            return new LifecycleReport(
                    key.id(),
                    key.keyId(),
                    state,
                    key.status(),
                    key.createdAt(),
                    key.expiresAt(),
                    key.expiresAt() != null ? daysUntil(now, key.expiresAt()) : null,
                    key.nextRotationAt() != null,
                    key.nextRotationAt(),
                    key.metadata().get(META_REPLACES),
                    key.metadata().get(META_DEPRECATED_BY),
                    recommendations(key, state));
        });
    }

    /**
     * Check expiring keys, expire old keys, then process scheduled rotations.
     */
    @Override
    public Uni<LifecycleCycleResult> runCycle() {
        return checkExpiringKeys()
                .flatMap(notices -> expireOldKeys()
                        .flatMap(expired -> processScheduledRotations()
                                .map(rotations -> new LifecycleCycleResult(notices, expired, rotations))));
    }

    LifecycleState lifecycleState(ApiKeyRecord key, Instant now) {
        if (key.status() != ApiKeyStatus.ACTIVE) {
            return switch (key.status()) {
                case REVOKED -> LifecycleState.REVOKED;
                case EXPIRED -> LifecycleState.EXPIRED;
                default -> LifecycleState.DEPRECATED;
            };
        }
        if (key.expiresAt() == null) {
            return LifecycleState.ACTIVE;
        }
        final var days = daysUntil(now, key.expiresAt());
        if (days <= 0) {
            return LifecycleState.EXPIRED;
        }
        return days <= EXPIRING_SOON_DAYS ? LifecycleState.EXPIRING_SOON : LifecycleState.ACTIVE;
    }

    private Uni<RotationResult> rotateExisting(
            ApiKeyRecord old, RotationTrigger trigger, Duration transition, Instant now) {
        if (old.status() == ApiKeyStatus.REVOKED || old.status() == ApiKeyStatus.EXPIRED) {
            return Uni.createFrom()
                    .item(RotationResult.failed(
                            old.keyId(),
                            trigger,
                            now,
                            "API key cannot be rotated",
                            List.of("API key is " + old.status().value())));
        }

        final var material = keyMaterial.generate();
        final var replacementId = UUID.randomUUID().toString();
        final var rotationMetadata = Map.of(
                META_ROTATION_TRIGGER, trigger.value(),
                META_ROTATION_TIMESTAMP, now.toString(),
                META_TRANSITION_DAYS, Long.toString(transition.toDays()));

        final var replacement = ApiKeyRecord.builder(replacementId, material.keyId(), material.digest())
                .name(old.name() + " (Rotated " + ROTATED_NAME_DATE.format(now) + ")")
                .userId(old.userId())
                .status(ApiKeyStatus.ACTIVE)
                .scopes(old.scopes())
                .allowedIps(old.allowedIps())
                .allowedDomains(old.allowedDomains())
                .rateLimit(old.rateLimit())
                .rateLimitPeriod(old.rateLimitPeriod())
                .expiresAt(rotatedExpiry(old, now))
                .replacesId(old.id())
                .rotationInterval(old.rotationInterval())
                .nextRotationAt(old.rotationInterval() != null ? now.plus(old.rotationInterval()) : null)
                .metadata(merge(old.metadata(), META_REPLACES, old.keyId(), rotationMetadata))
                .createdAt(now)
                .build();

        final var retired = old.toBuilder()
                .status(trigger.immediate() ? ApiKeyStatus.REVOKED : ApiKeyStatus.SUSPENDED)
                .expiresAt(trigger.immediate() ? old.expiresAt() : now.plus(transition))
                .replacedById(replacementId)
                .rotationInterval(null)
                .nextRotationAt(null)
                .metadata(merge(old.metadata(), META_DEPRECATED_BY, material.keyId(), rotationMetadata))
                .build();

        final var transitionMessage = trigger.immediate()
                ? "Old key immediately revoked due to security concern"
                : "Old key will be revoked after " + transition.toDays() + " day transition period";

        return repository.saveRotation(retired, replacement).map(ignored -> {
            final var result = RotationResult.succeeded(
                    old.keyId(),
                    material.keyId(),
                    material.presentedKey(),
                    trigger,
                    now,
                    transition,
                    "API key rotated successfully. " + transitionMessage);
            LOG.infov("Rotated API key {0} -> {1} (trigger: {2})", old.keyId(), material.keyId(), trigger.value());
            activity.keyRotated(old, result);
            notifyRotated(old, result);
            return result;
        });
    }

    // The replacement keeps the old expiry, extended to a minimum validity and capped by the max TTL.
    private Instant rotatedExpiry(ApiKeyRecord old, Instant now) {
        if (old.expiresAt() == null || !old.expiresAt().isAfter(now)) {
            return null;
        }
        final var minimum = now.plus(config.minimumRotatedValidity());
        var expiry = old.expiresAt().isAfter(minimum) ? old.expiresAt() : minimum;
        final var maxTtl = apiKeyConfig.maxTtl();
        if (maxTtl.isPresent() && expiry.isAfter(now.plus(maxTtl.get()))) {
            expiry = now.plus(maxTtl.get());
        }
        return expiry;
    }

    private Uni<String> expire(ApiKeyRecord key) {
        return repository.updateStatus(key.id(), ApiKeyStatus.EXPIRED).map(updated -> {
            if (!updated) {
                return null;
            }
            LOG.infov("Expired API key: {0} ({1})", key.keyId(), key.name());
            activity.keyExpired(key);
            return key.id();
        });
    }

    private ExpirationNotice notice(ApiKeyRecord key, Instant now) {
        final var days = daysUntil(now, key.expiresAt());
        final NoticeLevel level;
        if (days <= 0) {
            level = NoticeLevel.EXPIRED;
        } else if (days <= config.criticalDays()) {
            level = NoticeLevel.CRITICAL;
        } else if (days <= config.urgentDays()) {
            level = NoticeLevel.URGENT;
        } else {
            level = NoticeLevel.WARNING;
        }
        return new ExpirationNotice(
                key.id(), key.keyId(), key.name(), key.userId(), key.expiresAt(), days, level, actions(level, days));
    }

    private static List<String> actions(NoticeLevel level, long days) {
        return switch (level) {
            case EXPIRED -> List.of(
                    "API key has expired and is no longer valid",
                    "Create a new API key immediately",
                    "Update your applications with the new key",
                    "Contact support if you need help");
            case CRITICAL -> List.of(
                    "API key expires in " + days + " day(s)",
                    "Rotate the key immediately",
                    "Update your applications with the new key",
                    "Test the new key before the old one expires");
            case URGENT -> List.of(
                    "API key expires in " + days + " days",
                    "Plan key rotation within the next few days",
                    "Prepare to update your applications",
                    "Consider enabling auto-rotation for the future");
            case WARNING -> List.of(
                    "API key expires in " + days + " days",
                    "Schedule key rotation in the coming weeks",
                    "Review key usage and permissions",
                    "Consider setting up auto-rotation");
        };
    }

    private static List<String> recommendations(ApiKeyRecord key, LifecycleState state) {
        final var recommendations = new ArrayList<String>();
        if (state == LifecycleState.EXPIRING_SOON) {
            recommendations.add("Consider rotating the key soon to avoid service interruption");
            recommendations.add("Enable auto-rotation for future keys");
        } else if (state == LifecycleState.ACTIVE) {
            if (key.expiresAt() == null) {
                recommendations.add("Consider setting an expiration date for security");
            }
            if (key.nextRotationAt() == null) {
                recommendations.add("Enable auto-rotation for better security");
            }
        } else if (state == LifecycleState.EXPIRED) {
            recommendations.add("Create a new API key to restore service");
            recommendations.add("Update your applications with the new key");
        }
        if (key.scopes().contains(ScopeCatalog.ADMIN)) {
            recommendations.add("Review admin permissions regularly");
        }
        if (key.allowedIps().isEmpty()) {
            recommendations.add("Consider restricting access to specific IP addresses");
        }
        return recommendations;
    }

    private void notifyExpiring(ExpirationNotice notice) {
        activity.keyExpiring(notice);
        try {
            notifier.expiring(notice);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to send expiration notice for API key {0}", notice.keyId());
        }
    }

    private void notifyRotated(ApiKeyRecord old, RotationResult result) {
        try {
            notifier.rotated(old, result);
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to send rotation notice for API key {0}", old.keyId());
        }
    }

    private static Map<String, String> merge(
            Map<String, String> existing, String linkName, String linkValue, Map<String, String> rotationMetadata) {
        final var merged = new HashMap<String, String>(existing);
        merged.put(linkName, linkValue);
        merged.putAll(rotationMetadata);
        return merged;
    }

    // Whole days, rounded down, so a key expiring in 12 hours has 0 days left.
    private static long daysUntil(Instant now, Instant target) {
        return Math.floorDiv(Duration.between(now, target).getSeconds(), SECONDS_PER_DAY);
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
