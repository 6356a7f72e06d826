package turnstile.core.model.lifecycle;

import java.time.Instant;
import java.util.List;

/**
 * Notice about a key approaching (or past) its expiry.
 *
 * @param apiKeyId         record id
 * @param keyId            public key id
 * @param keyName          display name
 * @param userId           owner
 * @param expiresAt        expiry
 * @param daysUntilExpiry  whole days left, zero or negative once expired
 * @param level            urgency
 * @param suggestedActions actions to suggest to the owner
 */
public record ExpirationNotice(
        String apiKeyId,
        String keyId,
        String keyName,
        String userId,
        Instant expiresAt,
        long daysUntilExpiry,
        NoticeLevel level,
        List<String> suggestedActions) {

    public ExpirationNotice {
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }
}
