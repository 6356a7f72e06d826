package turnstile.core.model.lifecycle;

import java.time.Instant;
import java.util.List;

import turnstile.core.model.auth.ApiKeyStatus;

/**
 * Lifecycle report for one key.
 *
 * @param apiKeyId            record id
 * @param keyId               public key id
 * @param state               derived lifecycle state
 * @param status              persisted status
 * @param createdAt           creation time
 * @param expiresAt           expiry (null = never)
 * @param daysUntilExpiry     whole days until expiry (null when no expiry)
 * @param autoRotationEnabled whether automatic rotation is scheduled
 * @param nextRotationAt      next scheduled rotation (null when not scheduled)
 * @param replacesKeyId       key this one replaced (null if none)
 * @param replacedByKeyId     key that replaced this one (null if none)
 * @param recommendations     suggestions for the owner
 */
public record LifecycleReport(
        String apiKeyId,
        String keyId,
        LifecycleState state,
        ApiKeyStatus status,
        Instant createdAt,
        Instant expiresAt,
        Long daysUntilExpiry,
        boolean autoRotationEnabled,
        Instant nextRotationAt,
        String replacesKeyId,
        String replacedByKeyId,
        List<String> recommendations) {

    public LifecycleReport {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
