package turnstile.adapter.out.ratelimit;

import java.time.Clock;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import turnstile.adapter.out.ratelimit.memory.InMemoryRateLimitStore;
import turnstile.adapter.out.ratelimit.memory.InMemoryRateLimitStoreProvider;
import turnstile.adapter.out.ratelimit.redis.RedisRateLimitStoreProvider;
import turnstile.core.config.RateLimitingConfig;
import turnstile.core.port.out.LocalFallback;
import turnstile.core.port.out.RateLimitStore;
import turnstile.spi.RateLimitStoreProvider;

/**
 * CDI producer for rate limit stores.
 *
 * <p>Selects the primary store based on configuration and availability:
 * <ul>
 *   <li>Redis (priority 10) - Used when Redis is enabled and a data source is available</li>
 *   <li>In-memory (priority 0) - Fallback, always available</li>
 * </ul>
 *
 * <p>The in-memory store is also exposed as the {@link LocalFallback} store. When the
 * primary is in-memory, both injection points receive the same instance.
 */
@ApplicationScoped
public class RateLimitStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(RateLimitStoreProviderLoader.class);

    private final RateLimitingConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Clock clock;

    private InMemoryRateLimitStore localStore;

    @Inject
    public RateLimitStoreProviderLoader(
            RateLimitingConfig config, Instance<ReactiveRedisDataSource> redisDataSource, Clock clock) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.clock = clock;
    }

    /**
     * Produces the primary rate limit store.
     *
     * @return the selected store
     */
    @Produces
    @ApplicationScoped
    public RateLimitStore produceRateLimitStore() {
        final var provider = Stream.concat(createRedisProvider().stream(), Stream.of(createInMemoryProvider()))
                .filter(RateLimitStoreProvider::isAvailable)
                .max(Comparator.comparingInt(RateLimitStoreProvider::priority))
                .orElseThrow();

        LOG.infov(
                "Using rate limit store provider: {0} (algorithm={1}, failurePolicy={2})",
                provider.name(), config.algorithm(), config.failurePolicy());

        if (provider instanceof InMemoryRateLimitStoreProvider) {
            return localStore();
        }
        return provider.createStore();
    }

    /**
     * Produces the process-local store used when the primary store fails.
     *
     * @return the in-memory store
     */
    @Produces
    @ApplicationScoped
    @LocalFallback
    public RateLimitStore produceLocalFallbackStore() {
        return localStore();
    }

    /**
     * Clears the in-memory store on shutdown.
     */
    void disposeLocalFallbackStore(@Disposes @LocalFallback RateLimitStore store) {
        if (localStore != null) {
            localStore.shutdown();
        }
    }

    private synchronized InMemoryRateLimitStore localStore() {
        if (localStore == null) {
            localStore = (InMemoryRateLimitStore) createInMemoryProvider().createStore();
        }
        return localStore;
    }

    private Optional<RateLimitStoreProvider> createRedisProvider() {
        if (!config.redis().enabled()) {
            LOG.debug("Redis rate limiting not enabled in configuration");
            return Optional.empty();
        }

        if (!redisDataSource.isResolvable()) {
            LOG.warn("Redis rate limiting enabled but ReactiveRedisDataSource not available");
            return Optional.empty();
        }

        try {
            final var ds = redisDataSource.get();
            return Optional.of(RedisRateLimitStoreProvider.configured(
                    ds, config.redis().keyPrefix(), config.backendTimeout(), clock));
        } catch (RuntimeException e) {
            LOG.warnv(e, "Failed to initialize Redis rate limit store, falling back to in-memory");
            return Optional.empty();
        }
    }

    private RateLimitStoreProvider createInMemoryProvider() {
        return InMemoryRateLimitStoreProvider.configured(clock, config.cleanupInterval());
    }
}
