package turnstile.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for API key material and lookups.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code turnstile.api-keys.hmac-secret} - Server-side key used to digest secrets (required, 32+ chars)</li>
 *   <li>{@code turnstile.api-keys.key-id-prefix} - Prefix of public key ids</li>
 *   <li>{@code turnstile.api-keys.secret-prefix} - Prefix of secrets</li>
 *   <li>{@code turnstile.api-keys.lookup-timeout} - Bound on key record lookups</li>
 *   <li>{@code turnstile.api-keys.max-ttl} - Maximum TTL duration for API keys (optional)</li>
 * </ul>
 *
 * <h2>Example</h2>
 * <pre>
 * turnstile.api-keys.hmac-secret=${TURNSTILE_HMAC_SECRET}
 * turnstile.api-keys.max-ttl=P365D   # Max 1 year
 * </pre>
 */
@ConfigMapping(prefix = "turnstile.api-keys")
public interface ApiKeyConfig {

    /**
     * Server-side HMAC key. Changing it invalidates every stored digest.
     *
     * @return the HMAC key
     */
    @WithName("hmac-secret")
    String hmacSecret();

    @WithName("key-id-prefix")
    @WithDefault("ak_")
    String keyIdPrefix();

    @WithName("secret-prefix")
    @WithDefault("sk_")
    String secretPrefix();

    /**
     * Maximum time to wait for the key record store on the request path.
     *
     * @return lookup timeout (default: 2 seconds)
     */
    @WithName("lookup-timeout")
    @WithDefault("PT2S")
    Duration lookupTimeout();

    /**
     * Maximum TTL duration for API keys.
     *
     * <p>Rotated keys never receive an expiry beyond this from the time of rotation.
     *
     * @return the maximum TTL duration, or empty if not configured
     */
    Optional<Duration> maxTtl();
}
