package turnstile.core.config;

import java.time.Duration;
import java.util.List;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import turnstile.core.model.ratelimit.FailurePolicy;
import turnstile.core.model.ratelimit.RateLimitAlgorithm;

/**
 * Configuration mapping for rate limiting.
 *
 * <p>Configuration prefix: {@code turnstile.rate-limiting}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code TURNSTILE_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code TURNSTILE_RATE_LIMITING_ALGORITHM} - FIXED_WINDOW, SLIDING_WINDOW, SLIDING_LOG, TOKEN_BUCKET</li>
 *   <li>{@code TURNSTILE_RATE_LIMITING_FAILURE_POLICY} - DENY or ALLOW when the store is unreachable</li>
 * </ul>
 */
@ConfigMapping(prefix = "turnstile.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Algorithm applied to every layer.
     *
     * @return the algorithm (default: SLIDING_WINDOW)
     */
    @WithDefault("SLIDING_WINDOW")
    RateLimitAlgorithm algorithm();

    /**
     * What to do when the store cannot be reached and no fallback applies.
     *
     * @return the policy (default: DENY)
     */
    @WithName("failure-policy")
    @WithDefault("DENY")
    FailurePolicy failurePolicy();

    /**
     * Evaluate against a process-local store when the primary store fails.
     *
     * @return true to fall back (default: true)
     */
    @WithName("fallback-to-memory")
    @WithDefault("true")
    boolean fallbackToMemory();

    /**
     * Timeout for a single store operation.
     *
     * @return timeout (default: 250ms)
     */
    @WithName("backend-timeout")
    @WithDefault("PT0.25S")
    Duration backendTimeout();

    /**
     * Minimum interval between sweeps of expired in-memory entries.
     *
     * @return interval (default: 5 minutes)
     */
    @WithName("cleanup-interval")
    @WithDefault("PT5M")
    Duration cleanupInterval();

    /**
     * Scope per-key counters to the endpoint as well as the key.
     *
     * @return true for per-endpoint counters (default: false)
     */
    @WithName("per-endpoint-keys")
    @WithDefault("false")
    boolean perEndpointKeys();

    GlobalConfig global();

    /**
     * Endpoint limits in priority order. The first matching prefix applies.
     */
    List<EndpointConfig> endpoints();

    RedisConfig redis();

    /**
     * System-wide limit shared by all keys.
     */
    interface GlobalConfig {

        @WithDefault("true")
        boolean enabled();

        @WithName("requests-per-window")
        @WithDefault("1000")
        long requestsPerWindow();

        @WithName("window-seconds")
        @WithDefault("60")
        long windowSeconds();
    }

    /**
     * Limit shared by all keys calling paths under a prefix.
     */
    interface EndpointConfig {

        @WithName("path-prefix")
        String pathPrefix();

        @WithName("requests-per-window")
        long requestsPerWindow();

        @WithName("window-seconds")
        @WithDefault("3600")
        long windowSeconds();
    }

    /**
     * Redis-specific rate limiting configuration.
     */
    interface RedisConfig {

        /**
         * Enable Redis as the rate limiting backend.
         *
         * <p>When enabled and Redis is available, Redis will be used for
         * distributed rate limiting. When disabled or unavailable, falls
         * back to in-memory.
         *
         * @return true to use Redis backend (default: false)
         */
        @WithDefault("false")
        boolean enabled();

        /**
         * Key prefix for rate limit entries in Redis.
         *
         * @return key prefix (default: "turnstile:ratelimit:")
         */
        @WithName("key-prefix")
        @WithDefault("turnstile:ratelimit:")
        String keyPrefix();
    }
}
