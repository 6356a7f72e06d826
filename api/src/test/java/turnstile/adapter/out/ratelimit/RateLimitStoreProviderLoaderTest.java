package turnstile.adapter.out.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import jakarta.enterprise.inject.Instance;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import turnstile.adapter.out.ratelimit.memory.InMemoryRateLimitStore;
import turnstile.adapter.out.ratelimit.redis.RedisRateLimitStore;
import turnstile.core.config.RateLimitingConfig;
import turnstile.core.model.ratelimit.RateLimitAlgorithm;
import turnstile.testing.MutableClock;
import turnstile.testing.TestConfigs;

@DisplayName("RateLimitStoreProviderLoader")
class RateLimitStoreProviderLoaderTest {

    private RateLimitingConfig config;
    private Instance<ReactiveRedisDataSource> redisInstance;
    private MutableClock clock;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        config = TestConfigs.rateLimiting(RateLimitAlgorithm.SLIDING_WINDOW);
        redisInstance = mock(Instance.class);
        clock = MutableClock.at("2024-01-01T00:00:00Z");
    }

    private RateLimitStoreProviderLoader loader() {
        return new RateLimitStoreProviderLoader(config, redisInstance, clock);
    }

    @Test
    @DisplayName("should use the in-memory store when Redis is disabled")
    void shouldUseMemoryWhenRedisDisabled() {
        var loader = loader();

        var store = loader.produceRateLimitStore();

        assertInstanceOf(InMemoryRateLimitStore.class, store);
        verify(redisInstance, never()).get();
    }

    @Test
    @DisplayName("should share one in-memory instance between primary and fallback")
    void shouldShareMemoryInstance() {
        var loader = loader();

        assertSame(loader.produceRateLimitStore(), loader.produceLocalFallbackStore());
    }

    @Test
    @DisplayName("should fall back to memory when Redis is enabled but no data source exists")
    void shouldFallBackWhenDataSourceMissing() {
        when(config.redis().enabled()).thenReturn(true);
        when(redisInstance.isResolvable()).thenReturn(false);

        var store = loader().produceRateLimitStore();

        assertEquals("memory", store.name());
    }

    @Test
    @DisplayName("should fall back to memory when the data source cannot be created")
    void shouldFallBackWhenDataSourceFails() {
        when(config.redis().enabled()).thenReturn(true);
        when(redisInstance.isResolvable()).thenReturn(true);
        when(redisInstance.get()).thenThrow(new IllegalStateException("no redis hosts configured"));

        var store = loader().produceRateLimitStore();

        assertEquals("memory", store.name());
    }

    @Test
    @DisplayName("should prefer Redis over memory when available")
    void shouldPreferRedis() {
        when(config.redis().enabled()).thenReturn(true);
        when(redisInstance.isResolvable()).thenReturn(true);
        when(redisInstance.get()).thenReturn(mock(ReactiveRedisDataSource.class));
        var loader = loader();

        var primary = loader.produceRateLimitStore();
        var fallback = loader.produceLocalFallbackStore();

        assertInstanceOf(RedisRateLimitStore.class, primary);
        assertInstanceOf(InMemoryRateLimitStore.class, fallback);
        assertNotSame(primary, fallback);
    }
}
