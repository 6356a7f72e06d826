package turnstile.core.service.ratelimit;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.RateLimitingConfig;
import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.ratelimit.AlgorithmRegistry;
import turnstile.core.model.ratelimit.EffectiveRateLimit;
import turnstile.core.model.ratelimit.EndpointRateLimit;
import turnstile.core.model.ratelimit.FailurePolicy;
import turnstile.core.model.ratelimit.RateLimitDecision;
import turnstile.core.model.ratelimit.RateLimitLayer;
import turnstile.core.model.ratelimit.RateLimitResult;
import turnstile.core.model.ratelimit.RateLimitStatus;
import turnstile.core.model.ratelimit.RateLimitUnavailableException;
import turnstile.core.port.out.LocalFallback;
import turnstile.core.port.out.RateLimitStore;
import turnstile.core.service.activity.ActivityRecorder;

/**
 * Applies the per-key, global and endpoint rate limit layers to a request.
 *
 * <p>Layers run in that order and stop at the first rejection; earlier layers are not
 * refunded when a later one rejects. The request cost is charged to every layer that
 * admits it.
 *
 * <p>When the store fails, the check is retried against the process-local fallback store
 * (if enabled). If that is not possible the configured {@link FailurePolicy} decides, and
 * the result is flagged as unavailable.
 */
@ApplicationScoped
public class RateLimitManager {

    private static final Logger LOG = Logger.getLogger(RateLimitManager.class);

    static final String PER_KEY_PREFIX = "key:";
    static final String GLOBAL_KEY = "global";
    static final String ENDPOINT_PREFIX = "endpoint:";

    private final RateLimiter primary;
    private final Optional<RateLimiter> fallback;
    private final RateLimitingConfig config;
    private final ActivityRecorder activity;
    private final Clock clock;
    private final Optional<EffectiveRateLimit> globalLimit;
    private final List<EndpointRateLimit> endpointLimits;

    @Inject
    public RateLimitManager(
            RateLimitStore store,
            @LocalFallback RateLimitStore fallbackStore,
            AlgorithmRegistry algorithmRegistry,
            RateLimitingConfig config,
            ActivityRecorder activity,
            Clock clock) {
        final var handler = algorithmRegistry.getHandler(config.algorithm());
        this.primary = new StoreBackedRateLimiter(handler, store);
        this.fallback = config.fallbackToMemory() && !fallbackStore.name().equals(store.name())
                ? Optional.of(new StoreBackedRateLimiter(handler, fallbackStore))
                : Optional.empty();
        this.config = config;
        this.activity = activity;
        this.clock = clock;
        this.globalLimit = config.global().enabled()
                ? Optional.of(new EffectiveRateLimit(
                        config.global().requestsPerWindow(), config.global().windowSeconds()))
                : Optional.empty();
        this.endpointLimits = config.endpoints().stream()
                .map(endpoint -> new EndpointRateLimit(
                        endpoint.pathPrefix(),
                        new EffectiveRateLimit(endpoint.requestsPerWindow(), endpoint.windowSeconds())))
                .toList();

        LOG.infov(
                "Rate limiting enabled={0}, algorithm={1}, store={2}, fallback={3}, endpointLimits={4}",
                config.enabled(),
                handler.algorithm().wireName(),
                store.name(),
                fallback.isPresent() ? fallbackStore.name() : "none",
                endpointLimits.size());
    }

    public Uni<RateLimitResult> check(ApiKeyRecord apiKey, String endpoint, long cost) {
        return check(apiKey, endpoint, cost, null);
    }

    /**
     * Check a request against every layer.
     *
     * @param apiKey   the authenticated key
     * @param endpoint the request path
     * @param cost     the request cost
     * @param sourceIp the requester IP, used only for activity events (may be null)
     * @return Uni with the combined result
     */
    public Uni<RateLimitResult> check(ApiKeyRecord apiKey, String endpoint, long cost, String sourceIp) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be non-negative, got: " + cost);
        }
        if (!config.enabled()) {
            return Uni.createFrom().item(RateLimitResult.admitted(RateLimitDecision.unlimited(clock.instant())));
        }

        return checkPerKey(apiKey, endpoint, cost)
                .flatMap(perKey -> {
                    if (!perKey.allowed()) {
                        return Uni.createFrom().item(RateLimitResult.rejected(RateLimitLayer.PER_KEY, perKey));
                    }
                    return checkGlobal(cost).flatMap(global -> {
                        if (global.isPresent() && !global.get().allowed()) {
                            return Uni.createFrom().item(RateLimitResult.rejected(RateLimitLayer.GLOBAL, global.get()));
                        }
                        return checkEndpoint(endpoint, cost).map(endpointDecision -> endpointDecision
                                .filter(decision -> !decision.allowed())
                                .map(decision -> RateLimitResult.rejected(RateLimitLayer.ENDPOINT, decision))
                                .orElseGet(() -> RateLimitResult.admitted(perKey)));
                    });
                })
                .onFailure(RateLimitUnavailableException.class)
                .recoverWithItem(error -> {
                    final var allowed = config.failurePolicy() == FailurePolicy.ALLOW;
                    LOG.warnv(
                            "Rate limiting unavailable for keyId={0}, failure policy {1}: {2}",
                            apiKey.keyId(), config.failurePolicy(), error.getMessage());
                    return RateLimitResult.unavailable(allowed);
                })
                .call(result -> recordOutcome(apiKey, endpoint, sourceIp, result));
    }

    /**
     * Report current per-key usage without consuming quota.
     *
     * @param apiKey the key
     * @return Uni with the status; fails with {@link RateLimitUnavailableException} when no
     *         store can answer
     */
    public Uni<RateLimitStatus> status(ApiKeyRecord apiKey) {
        if (!config.enabled() || apiKey.configuredRateLimit().isEmpty()) {
            return Uni.createFrom()
                    .item(new RateLimitStatus(
                            apiKey.keyId(), apiKey.rateLimitPeriod(), RateLimitDecision.unlimited(clock.instant())));
        }
        return checkPerKey(apiKey, null, 0)
                .map(decision -> new RateLimitStatus(apiKey.keyId(), apiKey.rateLimitPeriod(), decision));
    }

    /**
     * Clear the per-key counters of a key, including per-endpoint counters.
     *
     * @param apiKey the key
     * @return Uni with true if any state was cleared
     */
    public Uni<Boolean> resetKey(ApiKeyRecord apiKey) {
        final var baseKey = PER_KEY_PREFIX + apiKey.id();
        final var primaryReset = primary.reset(baseKey);
        final Uni<Boolean> reset = fallback.isEmpty()
                ? primaryReset
                : primaryReset.flatMap(cleared -> fallback.get()
                        .reset(baseKey)
                        .map(fallbackCleared -> cleared || fallbackCleared));
        return reset.invoke(cleared -> {
            LOG.infov("Rate limit state reset for keyId={0}, cleared={1}", apiKey.keyId(), cleared);
            activity.rateLimitReset(apiKey.keyId(), cleared);
        });
    }

    /**
     * The endpoint limit that applies to a path, by first match in declaration order.
     *
     * @param path the request path
     * @return the matching endpoint limit
     */
    public Optional<EndpointRateLimit> endpointLimitFor(String path) {
        return endpointLimits.stream().filter(limit -> limit.matches(path)).findFirst();
    }

    private Uni<RateLimitDecision> checkPerKey(ApiKeyRecord apiKey, String endpoint, long cost) {
        final var configured = apiKey.configuredRateLimit();
        if (configured.isEmpty()) {
            return Uni.createFrom().item(RateLimitDecision.unlimited(clock.instant()));
        }
        final var limit = EffectiveRateLimit.of(configured.getAsLong(), apiKey.rateLimitPeriod());
        return evaluate(perKeyKey(apiKey, endpoint), limit, cost);
    }

    private Uni<Optional<RateLimitDecision>> checkGlobal(long cost) {
        if (globalLimit.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return evaluate(GLOBAL_KEY, globalLimit.get(), cost).map(Optional::of);
    }

    private Uni<Optional<RateLimitDecision>> checkEndpoint(String endpoint, long cost) {
        final var matched = endpointLimitFor(endpoint);
        if (matched.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var limit = matched.get();
        return evaluate(ENDPOINT_PREFIX + limit.pathPrefix(), limit.limit(), cost).map(Optional::of);
    }

    private Uni<RateLimitDecision> evaluate(String key, EffectiveRateLimit limit, long cost) {
        final var checked = primary.check(key, limit, cost);
        if (fallback.isEmpty()) {
            return checked;
        }
        return checked.onFailure(RateLimitUnavailableException.class).recoverWithUni(error -> {
            LOG.warnv("Rate limit store failed for {0}, using local fallback: {1}", key, error.getMessage());
            return fallback.get().check(key, limit, cost);
        });
    }

    private String perKeyKey(ApiKeyRecord apiKey, String endpoint) {
        final var base = PER_KEY_PREFIX + apiKey.id();
        if (config.perEndpointKeys() && endpoint != null && !endpoint.isBlank()) {
            return base + ":" + endpoint;
        }
        return base;
    }

    private Uni<Void> recordOutcome(ApiKeyRecord apiKey, String endpoint, String sourceIp, RateLimitResult result) {
        if (result.unavailable()) {
            return activity.rateLimitUnavailable(apiKey, endpoint, result.allowed());
        }
        if (!result.allowed()) {
            LOG.debugv(
                    "Rate limit exceeded: keyId={0}, layer={1}",
                    apiKey.keyId(),
                    result.rejectedBy().map(RateLimitLayer::wireName).orElse("unknown"));
            return activity.rateLimitExceeded(apiKey, sourceIp, endpoint, result);
        }
        return Uni.createFrom().voidItem();
    }
}
