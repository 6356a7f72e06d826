package turnstile.core.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.auth.ApiKeyStatus;

/**
 * Port interface for API key record persistence.
 *
 * <p>The admission core does not own the schema; it reads records by id or public key id
 * and writes status and expiry changes.
 */
public interface ApiKeyRepository {

    /**
     * Save or update a record.
     *
     * @param record the record to persist
     * @return Uni completing when the save is durable
     */
    Uni<Void> save(ApiKeyRecord record);

    /**
     * Persist both halves of a rotation in one step.
     *
     * <p>Either both records are written or neither is.
     *
     * @param retired     the old key, suspended or revoked
     * @param replacement the new key
     * @return Uni completing when both are durable
     */
    Uni<Void> saveRotation(ApiKeyRecord retired, ApiKeyRecord replacement);

    Uni<Optional<ApiKeyRecord>> findById(String id);

    /**
     * Find a record by its public key id.
     *
     * <p>Used on every authenticated request; implementations must index this lookup.
     *
     * @param keyId the public key id
     * @return Uni with the record if found
     */
    Uni<Optional<ApiKeyRecord>> findByKeyId(String keyId);

    Uni<List<ApiKeyRecord>> findByStatus(ApiKeyStatus status);

    /**
     * Update a record's status.
     *
     * @param id     record id
     * @param status new status
     * @return Uni with true if the record existed
     */
    Uni<Boolean> updateStatus(String id, ApiKeyStatus status);

    /**
     * Update a record's expiry.
     *
     * @param id        record id
     * @param expiresAt new expiry (null = never)
     * @return Uni with true if the record existed
     */
    Uni<Boolean> updateExpiry(String id, Instant expiresAt);
}
