package turnstile.spi;

import turnstile.core.port.out.RateLimitStore;

/**
 * Service Provider Interface for rate limit store implementations.
 *
 * <p>The loader selects among the configured providers by priority and availability.
 * Higher priority providers are preferred.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - Default, single-instance only</li>
 *   <li>Redis (priority 10) - Shared across instances</li>
 * </ul>
 *
 * @see turnstile.core.port.out.RateLimitStore
 */
public interface RateLimitStoreProvider {

    /**
     * Return the priority of this provider.
     *
     * <p>Higher values indicate higher priority.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider for logging and configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider is available in the current environment.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create a store instance.
     *
     * <p>Called once during application startup. The returned store must be thread-safe.
     *
     * @return the store
     */
    RateLimitStore createStore();
}
