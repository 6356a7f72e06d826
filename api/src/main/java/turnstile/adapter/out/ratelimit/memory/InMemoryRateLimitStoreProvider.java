package turnstile.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;

import turnstile.core.port.out.RateLimitStore;
import turnstile.spi.RateLimitStoreProvider;

/**
 * In-memory rate limit store provider.
 *
 * <p>This provider is always available as a fallback. It has the lowest
 * priority (0), so other providers (like Redis) will be preferred when available.
 *
 * <p>Configuration is passed during creation via the loader.
 */
public final class InMemoryRateLimitStoreProvider implements RateLimitStoreProvider {

    private static final int PRIORITY = 0;

    private final Clock clock;
    private final Duration cleanupInterval;

    /**
     * Create a new in-memory provider with configuration.
     *
     * @param clock           time source
     * @param cleanupInterval minimum time between sweeps of expired entries
     */
    public InMemoryRateLimitStoreProvider(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupInterval = cleanupInterval;
    }

    /**
     * Default constructor for ServiceLoader.
     *
     * <p>When loaded via ServiceLoader, configuration must be injected
     * separately via the loader.
     */
    public InMemoryRateLimitStoreProvider() {
        this.clock = null;
        this.cleanupInterval = null;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return InMemoryRateLimitStore.NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public RateLimitStore createStore() {
        if (clock == null) {
            throw new IllegalStateException(
                    "Provider not configured. Use RateLimitStoreProviderLoader for proper initialization.");
        }
        return new InMemoryRateLimitStore(clock, cleanupInterval);
    }

    /**
     * Create a configured provider instance.
     *
     * @param clock           time source
     * @param cleanupInterval minimum time between sweeps of expired entries
     * @return the configured provider
     */
    public static InMemoryRateLimitStoreProvider configured(Clock clock, Duration cleanupInterval) {
        return new InMemoryRateLimitStoreProvider(clock, cleanupInterval);
    }
}
