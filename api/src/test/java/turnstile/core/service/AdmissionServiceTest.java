package turnstile.core.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.adapter.out.ratelimit.memory.InMemoryRateLimitStore;
import turnstile.adapter.out.storage.memory.InMemoryApiKeyRepository;
import turnstile.core.config.ApiKeyConfig;
import turnstile.core.model.activity.ActivityType;
import turnstile.core.model.admission.AdmissionDecision;
import turnstile.core.model.admission.AdmissionRequest;
import turnstile.core.model.admission.AdmissionStage;
import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.auth.AuthenticationRequest;
import turnstile.core.model.auth.KeyMaterial;
import turnstile.core.model.auth.KeyStoreUnavailableException;
import turnstile.core.model.permission.Permission;
import turnstile.core.model.permission.Resource;
import turnstile.core.model.permission.ResourcePermission;
import turnstile.core.model.ratelimit.AlgorithmRegistry;
import turnstile.core.model.ratelimit.RateLimitAlgorithm;
import turnstile.core.model.ratelimit.RateLimitHeaders;
import turnstile.core.model.ratelimit.RateLimitPeriod;
import turnstile.core.port.out.ApiKeyRepository;
import turnstile.core.service.activity.ActivityRecorder;
import turnstile.core.service.auth.ApiKeyAuthenticator;
import turnstile.core.service.auth.KeyMaterialService;
import turnstile.core.service.permission.PermissionEvaluator;
import turnstile.core.service.ratelimit.RateLimitManager;
import turnstile.core.service.ratelimit.RequestCostCalculator;
import turnstile.testing.MutableClock;
import turnstile.testing.RecordingActivityLog;
import turnstile.testing.TestConfigs;

@DisplayName("AdmissionService")
class AdmissionServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String PATH = "/api/v1/users";
    private static final ResourcePermission USER_READ = ResourcePermission.of(Resource.USER, Permission.READ);

    private MutableClock clock;
    private ApiKeyConfig apiKeyConfig;
    private KeyMaterialService keyMaterial;
    private InMemoryApiKeyRepository repository;
    private RecordingActivityLog activityLog;
    private AdmissionService service;
    private KeyMaterial material;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T09:00:00Z");
        apiKeyConfig = TestConfigs.apiKeys();
        keyMaterial = new KeyMaterialService(apiKeyConfig);
        repository = new InMemoryApiKeyRepository();
        activityLog = new RecordingActivityLog();
        service = serviceWith(repository);

        material = keyMaterial.generate();
        repository
                .save(ApiKeyRecord.builder("k1", material.keyId(), material.digest())
                        .userId("user-1")
                        .scopes(Set.of("read"))
                        .rateLimit(3L)
                        .rateLimitPeriod(RateLimitPeriod.MINUTE)
                        .build())
                .await()
                .atMost(TIMEOUT);
    }

    private AdmissionService serviceWith(ApiKeyRepository keyRepository) {
        var store = new InMemoryRateLimitStore(clock, Duration.ofMinutes(5));
        var recorder = new ActivityRecorder(activityLog, store, TestConfigs.activity(), clock);
        var authenticator = new ApiKeyAuthenticator(keyRepository, keyMaterial, recorder, apiKeyConfig, clock);
        var rateLimits = new RateLimitManager(
                store,
                store,
                new AlgorithmRegistry(),
                TestConfigs.rateLimiting(RateLimitAlgorithm.SLIDING_WINDOW),
                recorder,
                clock);
        return new AdmissionService(
                authenticator, rateLimits, new RequestCostCalculator(), new PermissionEvaluator(), recorder);
    }

    private AdmissionDecision admit(String presentedKey, ResourcePermission required) {
        var request = new AdmissionRequest(AuthenticationRequest.of(presentedKey, "10.0.0.1", PATH), "GET", required);
        return service.admit(request).await().atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should admit until the per-key limit is spent, then reject with Retry-After")
    void shouldAdmitUntilLimitSpent() {
        for (var expectedRemaining = 2; expectedRemaining >= 0; expectedRemaining--) {
            var decision = admit(material.presentedKey(), USER_READ);

            assertTrue(decision.admitted());
            assertEquals(200, decision.statusCode());
            assertEquals(String.valueOf(expectedRemaining), decision.headers().get(RateLimitHeaders.REMAINING));
            assertEquals("3", decision.headers().get(RateLimitHeaders.LIMIT));
            clock.advanceMillis(100);
        }

        var rejected = admit(material.presentedKey(), USER_READ);

        assertFalse(rejected.admitted());
        assertEquals(AdmissionStage.RATE_LIMIT, rejected.stage());
        assertEquals(429, rejected.statusCode());
        assertTrue(rejected.headers().containsKey(RateLimitHeaders.RETRY_AFTER));
        assertEquals("rate_limit_exceeded", rejected.errorBody().get("error"));
        assertEquals(1, activityLog.ofType(ActivityType.RATE_LIMIT_EXCEEDED).size());
    }

    @Test
    @DisplayName("should admit a request that needs no permission")
    void shouldAdmitWithoutRequiredPermission() {
        var decision = admit(material.presentedKey(), null);

        assertTrue(decision.admitted());
        assertTrue(activityLog.ofType(ActivityType.PERMISSION_GRANTED).isEmpty());
    }

    @Test
    @DisplayName("should forbid a request the key's scopes do not cover")
    void shouldForbidMissingPermission() {
        var required = ResourcePermission.of(Resource.ANALYTICS, Permission.READ);

        var decision = admit(material.presentedKey(), required);

        assertEquals(AdmissionStage.PERMISSION, decision.stage());
        assertEquals(403, decision.statusCode());
        assertEquals(required, decision.denied());
        assertEquals("insufficient_permissions", decision.errorBody().get("error"));
        assertEquals("2", decision.headers().get(RateLimitHeaders.REMAINING));
        assertEquals(1, activityLog.ofType(ActivityType.PERMISSION_DENIED).size());
    }

    @Test
    @DisplayName("should stop at authentication without touching the rate limit")
    void shouldStopAtAuthentication() {
        var decision = admit(material.keyId() + ".sk_wrong", USER_READ);

        assertEquals(AdmissionStage.AUTHENTICATION, decision.stage());
        assertEquals(401, decision.statusCode());
        assertNull(decision.rateLimit());
        assertTrue(decision.headers().isEmpty());
        assertEquals("key_not_found", decision.errorBody().get("error"));

        assertEquals("2", admit(material.presentedKey(), USER_READ).headers().get(RateLimitHeaders.REMAINING));
    }

    @Test
    @DisplayName("should fail when the key store cannot be reached")
    void shouldFailWhenKeyStoreUnavailable() {
        var failing = mock(ApiKeyRepository.class);
        when(failing.findByKeyId(anyString()))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("connection reset")));
        service = serviceWith(failing);

        assertThrows(KeyStoreUnavailableException.class, () -> admit(material.presentedKey(), USER_READ));
    }
}
