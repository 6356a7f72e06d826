package turnstile.core.model.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

import turnstile.core.model.ratelimit.RateLimitPeriod;

/**
 * Stored API key as seen by the admission core.
 *
 * <p>Only the digest of the secret is stored. The public {@code keyId} is kept in plaintext
 * and indexed so a presented credential resolves to exactly one record.
 *
 * @param id                record identifier
 * @param keyId             public key identifier (e.g. {@code ak_...})
 * @param digest            keyed digest of the secret
 * @param name              display name
 * @param userId            owner of the key
 * @param status            persisted status
 * @param scopes            granted scopes
 * @param expiresAt         when the key expires (null = never)
 * @param allowedIps        source IP allowlist (empty = any)
 * @param allowedDomains    origin host allowlist (empty = any)
 * @param rateLimit         requests per period (null = unlimited)
 * @param rateLimitPeriod   period the rate limit applies to
 * @param replacesId        id of the key this one replaced through rotation (null if none)
 * @param replacedById      id of the key that replaced this one (null if none)
 * @param rotationInterval  automatic rotation interval (null = not scheduled)
 * @param nextRotationAt    next scheduled rotation (null = not scheduled)
 * @param metadata          free-form metadata (rotation reason, timestamps)
 * @param createdAt         creation time (null when the store did not record one)
 */
public record ApiKeyRecord(
        String id,
        String keyId,
        String digest,
        String name,
        String userId,
        ApiKeyStatus status,
        Set<String> scopes,
        Instant expiresAt,
        Set<String> allowedIps,
        Set<String> allowedDomains,
        Long rateLimit,
        RateLimitPeriod rateLimitPeriod,
        String replacesId,
        String replacedById,
        Duration rotationInterval,
        Instant nextRotationAt,
        Map<String, String> metadata,
        Instant createdAt) {

    public ApiKeyRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("API key record id cannot be null or blank");
        }
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("API key id cannot be null or blank");
        }
        if (digest == null || digest.isBlank()) {
            throw new IllegalArgumentException("API key digest cannot be null or blank");
        }
        if (rateLimit != null && rateLimit < 0) {
            throw new IllegalArgumentException("Rate limit must be non-negative");
        }
        if (name == null || name.isBlank()) {
            name = keyId;
        }
        if (status == null) {
            status = ApiKeyStatus.ACTIVE;
        }
        if (scopes != null && scopes.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Scopes cannot contain null");
        }
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        allowedIps = allowedIps == null ? Set.of() : Set.copyOf(allowedIps);
        allowedDomains = allowedDomains == null ? Set.of() : Set.copyOf(allowedDomains);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        if (rateLimitPeriod == null) {
            rateLimitPeriod = RateLimitPeriod.HOUR;
        }
    }

    /**
     * Returns the configured rate limit, if any.
     *
     * @return the requests-per-period limit, or empty when the key is unlimited
     */
    public OptionalLong configuredRateLimit() {
        return rateLimit == null ? OptionalLong.empty() : OptionalLong.of(rateLimit);
    }

    public Optional<Instant> expiry() {
        return Optional.ofNullable(expiresAt);
    }

    /**
     * Whether the key has passed its expiry at the given instant.
     *
     * @param now the current time
     * @return true if {@code expiresAt} is set and not after {@code now}
     */
    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * Whether the key is the old half of a rotation that is still inside its transition period.
     *
     * @param now the current time
     * @return true for a suspended, replaced key whose grace expiry lies in the future
     */
    public boolean isInTransition(Instant now) {
        return status == ApiKeyStatus.SUSPENDED
                && replacedById != null
                && expiresAt != null
                && expiresAt.isAfter(now);
    }

    public ApiKeyRecord withStatus(ApiKeyStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public ApiKeyRecord withExpiresAt(Instant newExpiresAt) {
        return toBuilder().expiresAt(newExpiresAt).build();
    }

    public Builder toBuilder() {
        return new Builder(id, keyId, digest)
                .name(name)
                .userId(userId)
                .status(status)
                .scopes(scopes)
                .expiresAt(expiresAt)
                .allowedIps(allowedIps)
                .allowedDomains(allowedDomains)
                .rateLimit(rateLimit)
                .rateLimitPeriod(rateLimitPeriod)
                .replacesId(replacesId)
                .replacedById(replacedById)
                .rotationInterval(rotationInterval)
                .nextRotationAt(nextRotationAt)
                .metadata(metadata)
                .createdAt(createdAt);
    }

    public static Builder builder(String id, String keyId, String digest) {
        return new Builder(id, keyId, digest);
    }

    public static class Builder {
        private final String id;
        private final String keyId;
        private final String digest;
        private String name;
        private String userId;
        private ApiKeyStatus status = ApiKeyStatus.ACTIVE;
        private Set<String> scopes = Set.of();
        private Instant expiresAt;
        private Set<String> allowedIps = Set.of();
        private Set<String> allowedDomains = Set.of();
        private Long rateLimit;
        private RateLimitPeriod rateLimitPeriod = RateLimitPeriod.HOUR;
        private String replacesId;
        private String replacedById;
        private Duration rotationInterval;
        private Instant nextRotationAt;
        private Map<String, String> metadata = Map.of();
        private Instant createdAt;

        private Builder(String id, String keyId, String digest) {
            this.id = id;
            this.keyId = keyId;
            this.digest = digest;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder status(ApiKeyStatus status) {
            this.status = status;
            return this;
        }

        public Builder scopes(Set<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder allowedIps(Set<String> allowedIps) {
            this.allowedIps = allowedIps;
            return this;
        }

        public Builder allowedDomains(Set<String> allowedDomains) {
            this.allowedDomains = allowedDomains;
            return this;
        }

        public Builder rateLimit(Long rateLimit) {
            this.rateLimit = rateLimit;
            return this;
        }

        public Builder rateLimitPeriod(RateLimitPeriod rateLimitPeriod) {
            this.rateLimitPeriod = rateLimitPeriod;
            return this;
        }

        public Builder replacesId(String replacesId) {
            this.replacesId = replacesId;
            return this;
        }

        public Builder replacedById(String replacedById) {
            this.replacedById = replacedById;
            return this;
        }

        public Builder rotationInterval(Duration rotationInterval) {
            this.rotationInterval = rotationInterval;
            return this;
        }

        public Builder nextRotationAt(Instant nextRotationAt) {
            this.nextRotationAt = nextRotationAt;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public ApiKeyRecord build() {
            return new ApiKeyRecord(
                    id,
                    keyId,
                    digest,
                    name,
                    userId,
                    status,
                    scopes,
                    expiresAt,
                    allowedIps,
                    allowedDomains,
                    rateLimit,
                    rateLimitPeriod,
                    replacesId,
                    replacedById,
                    rotationInterval,
                    nextRotationAt,
                    metadata,
                    createdAt);
        }
    }
}
