package turnstile.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.ApiKeyConfig;
import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.auth.ApiKeyStatus;
import turnstile.core.model.auth.AuthenticationOutcome;
import turnstile.core.model.auth.AuthenticationRequest;
import turnstile.core.model.auth.KeyStoreUnavailableException;
import turnstile.core.model.auth.PresentedCredential;
import turnstile.core.model.auth.RejectionReason;
import turnstile.core.port.out.ApiKeyRepository;
import turnstile.core.service.activity.ActivityRecorder;

/**
 * Authentication gate for presented API keys.
 *
 * <p>Checks, in order: a key was presented and is well formed, the key id exists and the
 * secret matches its digest, the status allows use, the key has not expired, and the
 * request IP and origin are allowed. The first failing check decides the outcome.
 *
 * <p>An unknown key id and a wrong secret both produce {@link RejectionReason#KEY_NOT_FOUND}.
 * Every outcome is recorded as an activity event.
 */
@ApplicationScoped
public class ApiKeyAuthenticator {

    private static final Logger LOG = Logger.getLogger(ApiKeyAuthenticator.class);

    // Verified against when the key id is unknown so both paths compute one HMAC.
    private static final String UNKNOWN_KEY_DIGEST = "0".repeat(64);

    private final ApiKeyRepository repository;
    private final KeyMaterialService keyMaterial;
    private final ActivityRecorder activity;
    private final Clock clock;
    private final Duration lookupTimeout;

    @Inject
    public ApiKeyAuthenticator(
            ApiKeyRepository repository,
            KeyMaterialService keyMaterial,
            ActivityRecorder activity,
            ApiKeyConfig config,
            Clock clock) {
        this.repository = repository;
        this.keyMaterial = keyMaterial;
        this.activity = activity;
        this.clock = clock;
        this.lookupTimeout = config.lookupTimeout();
    }

    /**
     * Authenticate a request.
     *
     * @param request the request
     * @return Uni with the outcome; fails with {@link KeyStoreUnavailableException} when the
     *         key record store cannot answer in time
     */
    public Uni<AuthenticationOutcome> authenticate(AuthenticationRequest request) {
        if (!request.hasPresentedKey()) {
            return reject(request, RejectionReason.NO_KEY_PRESENTED, null, null);
        }

        final var parsed = PresentedCredential.parse(request.presentedKey());
        if (parsed.isEmpty()) {
            return reject(request, RejectionReason.MALFORMED_CREDENTIAL, null, null);
        }
        final var credential = parsed.get();

        return repository
                .findByKeyId(credential.keyId())
                .ifNoItem()
                .after(lookupTimeout)
                .failWith(() -> new KeyStoreUnavailableException(
                        "Key record lookup timed out after " + lookupTimeout.toMillis() + "ms", null))
                .onFailure(error -> !(error instanceof KeyStoreUnavailableException))
                .transform(error -> new KeyStoreUnavailableException("Key record lookup failed", error))
                .onFailure()
                .invoke(error -> LOG.warnv(
                        "API key lookup failed for keyId={0}: {1}", credential.keyId(), error.getMessage()))
                .flatMap(found -> evaluate(request, credential, found));
    }

    private Uni<AuthenticationOutcome> evaluate(
            AuthenticationRequest request, PresentedCredential credential, Optional<ApiKeyRecord> found) {
        if (found.isEmpty()) {
            keyMaterial.verify(credential.secret(), UNKNOWN_KEY_DIGEST);
            return reject(request, RejectionReason.KEY_NOT_FOUND, credential.keyId(), null);
        }

        final var apiKey = found.get();
        if (!keyMaterial.verify(credential.secret(), apiKey.digest())) {
            return reject(request, RejectionReason.KEY_NOT_FOUND, credential.keyId(), apiKey);
        }

        final var now = clock.instant();
        if (apiKey.status() == ApiKeyStatus.REVOKED) {
            return reject(request, RejectionReason.REVOKED, apiKey.keyId(), apiKey);
        }
        if (apiKey.status() == ApiKeyStatus.EXPIRED || apiKey.isExpiredAt(now)) {
            return reject(request, RejectionReason.EXPIRED, apiKey.keyId(), apiKey);
        }

        final var deprecated = apiKey.status() == ApiKeyStatus.SUSPENDED;
        if (deprecated && !apiKey.isInTransition(now)) {
            return reject(request, RejectionReason.SUSPENDED, apiKey.keyId(), apiKey);
        }

        if (!ipAllowed(apiKey, request.sourceIp())) {
            return reject(request, RejectionReason.IP_REJECTED, apiKey.keyId(), apiKey);
        }
        if (!originAllowed(apiKey, request.originHost())) {
            return reject(request, RejectionReason.DOMAIN_REJECTED, apiKey.keyId(), apiKey);
        }

        if (deprecated) {
            LOG.debugv("Deprecated key {0} used during its rotation transition", apiKey.keyId());
        }
        final var outcome = deprecated ? AuthenticationOutcome.deprecated(apiKey) : AuthenticationOutcome.valid(apiKey);
        return activity.authenticationSucceeded(apiKey, request, deprecated).replaceWith(outcome);
    }

    private Uni<AuthenticationOutcome> reject(
            AuthenticationRequest request, RejectionReason reason, String keyId, ApiKeyRecord apiKey) {
        LOG.debugv("API key rejected: reason={0}, keyId={1}, ip={2}", reason.code(), keyId, request.sourceIp());
        return activity.authenticationFailed(request, reason, keyId, apiKey)
                .replaceWith(AuthenticationOutcome.rejected(reason, keyId));
    }

    // A request without a source IP cannot satisfy an allowlist.
    private static boolean ipAllowed(ApiKeyRecord apiKey, String sourceIp) {
        if (apiKey.allowedIps().isEmpty()) {
            return true;
        }
        return sourceIp != null && apiKey.allowedIps().contains(sourceIp.trim());
    }

    private static boolean originAllowed(ApiKeyRecord apiKey, String originHost) {
        if (apiKey.allowedDomains().isEmpty() || originHost == null) {
            return true;
        }
        return apiKey.allowedDomains().stream()
                .anyMatch(domain -> domain.toLowerCase(Locale.ROOT).equals(originHost));
    }
}
