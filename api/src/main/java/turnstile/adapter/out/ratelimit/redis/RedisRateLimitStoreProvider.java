package turnstile.adapter.out.ratelimit.redis;

import java.time.Clock;
import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import turnstile.core.port.out.RateLimitStore;
import turnstile.spi.RateLimitStoreProvider;

/**
 * Redis-based rate limit store provider for distributed deployments.
 *
 * <p>This provider has higher priority than in-memory (10 vs 0) and is
 * selected when Redis is enabled for rate limiting and a data source is present.
 */
public final class RedisRateLimitStoreProvider implements RateLimitStoreProvider {

    private static final int PRIORITY = 10;

    private final ReactiveRedisDataSource redisDataSource;
    private final String keyPrefix;
    private final Duration timeout;
    private final Clock clock;

    /**
     * Creates a new Redis provider with configuration.
     *
     * @param redisDataSource the Redis data source
     * @param keyPrefix       prefix for every key written
     * @param timeout         bound on each Redis call
     * @param clock           time source passed to the scripts
     */
    public RedisRateLimitStoreProvider(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, Duration timeout, Clock clock) {
        this.redisDataSource = redisDataSource;
        this.keyPrefix = keyPrefix;
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * Default constructor for ServiceLoader.
     */
    public RedisRateLimitStoreProvider() {
        this(null, null, null, null);
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return RedisRateLimitStore.NAME;
    }

    @Override
    public boolean isAvailable() {
        return redisDataSource != null;
    }

    @Override
    public RateLimitStore createStore() {
        if (redisDataSource == null) {
            throw new IllegalStateException(
                    "Provider not configured. Use RateLimitStoreProviderLoader for proper initialization.");
        }
        return new RedisRateLimitStore(redisDataSource, keyPrefix, timeout, clock);
    }

    public static RedisRateLimitStoreProvider configured(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, Duration timeout, Clock clock) {
        return new RedisRateLimitStoreProvider(redisDataSource, keyPrefix, timeout, clock);
    }
}
