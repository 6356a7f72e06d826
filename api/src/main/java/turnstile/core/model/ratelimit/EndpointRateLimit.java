package turnstile.core.model.ratelimit;

/**
 * A limit shared by every key calling paths under a prefix.
 *
 * @param pathPrefix path prefix to match
 * @param limit      the limit to apply
 */
public record EndpointRateLimit(String pathPrefix, EffectiveRateLimit limit) {

    public EndpointRateLimit {
        if (pathPrefix == null || pathPrefix.isBlank()) {
            throw new IllegalArgumentException("pathPrefix cannot be null or blank");
        }
        if (limit == null) {
            throw new IllegalArgumentException("limit cannot be null");
        }
    }

    public boolean matches(String path) {
        return path != null && path.startsWith(pathPrefix);
    }
}
