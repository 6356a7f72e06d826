package turnstile.adapter.out.storage.memory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.auth.ApiKeyStatus;
import turnstile.core.port.out.ApiKeyRepository;

/**
 * In-memory implementation of ApiKeyRepository.
 *
 * <p>Data is NOT persisted across restarts. Suitable for development, tests and
 * single-instance deployments where keys are provisioned at startup.
 *
 * <p>Thread-safety: Uses explicit synchronization to keep the id and key id indexes
 * consistent during writes. A rotation writes both records under one lock, so readers
 * never see the replacement without the retired key's new state.
 */
@ApplicationScoped
public class InMemoryApiKeyRepository implements ApiKeyRepository {

    private final ConcurrentHashMap<String, ApiKeyRecord> storageById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ApiKeyRecord> storageByKeyId = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    @Override
    public Uni<Void> save(ApiKeyRecord record) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                store(record);
            }
            return null;
        });
    }

    @Override
    public Uni<Void> saveRotation(ApiKeyRecord retired, ApiKeyRecord replacement) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                store(retired);
                store(replacement);
            }
            return null;
        });
    }

    @Override
    public Uni<Optional<ApiKeyRecord>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageById.get(id)));
    }

    @Override
    public Uni<Optional<ApiKeyRecord>> findByKeyId(String keyId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(storageByKeyId.get(keyId)));
    }

    @Override
    public Uni<List<ApiKeyRecord>> findByStatus(ApiKeyStatus status) {
        return Uni.createFrom().item(() -> storageById.values().stream()
                .filter(record -> record.status() == status)
                .toList());
    }

    @Override
    public Uni<Boolean> updateStatus(String id, ApiKeyStatus status) {
        return update(id, record -> record.withStatus(status));
    }

    @Override
    public Uni<Boolean> updateExpiry(String id, Instant expiresAt) {
        return update(id, record -> record.withExpiresAt(expiresAt));
    }

    private Uni<Boolean> update(String id, UnaryOperator<ApiKeyRecord> change) {
        return Uni.createFrom().item(() -> {
            synchronized (writeLock) {
                final var existing = storageById.get(id);
                if (existing == null) {
                    return false;
                }
                store(change.apply(existing));
                return true;
            }
        });
    }

    private void store(ApiKeyRecord record) {
        final var previous = storageById.put(record.id(), record);
        if (previous != null && !previous.keyId().equals(record.keyId())) {
            storageByKeyId.remove(previous.keyId());
        }
        storageByKeyId.put(record.keyId(), record);
    }
}
