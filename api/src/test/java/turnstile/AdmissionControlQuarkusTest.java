package turnstile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;

import jakarta.inject.Inject;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.core.model.activity.ActivityType;
import turnstile.core.model.admission.AdmissionDecision;
import turnstile.core.model.admission.AdmissionRequest;
import turnstile.core.model.admission.AdmissionStage;
import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.auth.AuthenticationRequest;
import turnstile.core.model.auth.KeyMaterial;
import turnstile.core.model.permission.Permission;
import turnstile.core.model.permission.Resource;
import turnstile.core.model.permission.ResourcePermission;
import turnstile.core.model.ratelimit.RateLimitHeaders;
import turnstile.core.model.ratelimit.RateLimitPeriod;
import turnstile.core.port.in.AdmissionControl;
import turnstile.core.port.out.ApiKeyRepository;
import turnstile.core.service.auth.KeyMaterialService;
import turnstile.core.service.ratelimit.RateLimitManager;
import turnstile.testing.CollectingActivityEventHandler;

/**
 * Runs admission through the CDI container with the shipped configuration.
 */
@QuarkusTest
@DisplayName("AdmissionControl in the application")
class AdmissionControlQuarkusTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String PATH = "/api/v1/users";
    private static final ResourcePermission USER_READ = ResourcePermission.of(Resource.USER, Permission.READ);

    @Inject
    AdmissionControl admissionControl;

    @Inject
    ApiKeyRepository repository;

    @Inject
    KeyMaterialService keyMaterial;

    @Inject
    RateLimitManager rateLimitManager;

    private KeyMaterial material;

    @BeforeEach
    void setUp() {
        CollectingActivityEventHandler.clear();
        material = keyMaterial.generate();
        repository
                .save(ApiKeyRecord.builder(UUID.randomUUID().toString(), material.keyId(), material.digest())
                        .userId("user-1")
                        .scopes(Set.of("read"))
                        .rateLimit(3L)
                        .rateLimitPeriod(RateLimitPeriod.MINUTE)
                        .build())
                .await()
                .atMost(TIMEOUT);
    }

    private AdmissionDecision admit(String presentedKey, ResourcePermission required) {
        var request = new AdmissionRequest(AuthenticationRequest.of(presentedKey, "10.0.0.1", PATH), "GET", required);
        return admissionControl.admit(request).await().atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should admit until the per-key limit is spent, then answer 429")
    void shouldEnforcePerKeyLimit() {
        for (var expectedRemaining = 2; expectedRemaining >= 0; expectedRemaining--) {
            var decision = admit(material.presentedKey(), USER_READ);

            assertTrue(decision.admitted());
            assertEquals(String.valueOf(expectedRemaining), decision.headers().get(RateLimitHeaders.REMAINING));
        }

        var rejected = admit(material.presentedKey(), USER_READ);

        assertFalse(rejected.admitted());
        assertEquals(429, rejected.statusCode());
        assertTrue(rejected.headers().containsKey(RateLimitHeaders.RETRY_AFTER));
        assertTrue(CollectingActivityEventHandler.events().stream()
                .anyMatch(event -> event.type() == ActivityType.RATE_LIMIT_EXCEEDED
                        && material.keyId().equals(event.keyId())));
    }

    @Test
    @DisplayName("should answer 403 for a permission the scopes do not grant")
    void shouldForbidMissingPermission() {
        var decision = admit(material.presentedKey(), ResourcePermission.of(Resource.ANALYTICS, Permission.READ));

        assertEquals(AdmissionStage.PERMISSION, decision.stage());
        assertEquals(403, decision.statusCode());
    }

    @Test
    @DisplayName("should answer 401 for a wrong secret")
    void shouldRejectWrongSecret() {
        var decision = admit(material.keyId() + ".sk_wrong", USER_READ);

        assertEquals(AdmissionStage.AUTHENTICATION, decision.stage());
        assertEquals(401, decision.statusCode());
    }

    @Test
    @DisplayName("should load endpoint limits from application.properties")
    void shouldLoadEndpointLimits() {
        var export = rateLimitManager.endpointLimitFor("/api/v1/analytics/export/daily").orElseThrow();

        assertEquals(10, export.limit().limit());
        assertEquals(3600, export.limit().windowSeconds());
        assertTrue(rateLimitManager.endpointLimitFor("/api/v1/users").isEmpty());
    }
}
