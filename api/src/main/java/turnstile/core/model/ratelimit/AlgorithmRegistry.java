package turnstile.core.model.ratelimit;

import java.util.EnumMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

/**
 * Registry for rate limiting algorithm handlers.
 *
 * <p>Every {@link RateLimitAlgorithm} has a handler; lookups never fall back.
 */
@ApplicationScoped
public class AlgorithmRegistry {

    private static final Logger LOG = Logger.getLogger(AlgorithmRegistry.class);

    private final Map<RateLimitAlgorithm, RateLimitAlgorithmHandler> handlers;

    /**
     * Create a new algorithm registry with all available handlers.
     */
    public AlgorithmRegistry() {
        this.handlers = new EnumMap<>(RateLimitAlgorithm.class);

        registerHandler(FixedWindowAlgorithm.getInstance());
        registerHandler(SlidingWindowAlgorithm.getInstance());
        registerHandler(SlidingLogAlgorithm.getInstance());
        registerHandler(TokenBucketAlgorithm.getInstance());

        LOG.debugv("Initialized algorithm registry with {0} handler(s)", handlers.size());
    }

    /**
     * Get the handler for the specified algorithm.
     *
     * @param algorithm the algorithm type
     * @return the algorithm handler
     * @throws IllegalArgumentException if no handler is registered
     */
    public RateLimitAlgorithmHandler getHandler(RateLimitAlgorithm algorithm) {
        final var handler = handlers.get(algorithm);
        if (handler == null) {
            throw new IllegalArgumentException("No handler registered for algorithm " + algorithm);
        }
        return handler;
    }

    /**
     * Get the handler by algorithm name.
     *
     * @param name the algorithm name, e.g. "token_bucket"
     * @return the algorithm handler
     * @throws IllegalArgumentException if the name is unknown
     */
    public RateLimitAlgorithmHandler getHandler(String name) {
        return getHandler(RateLimitAlgorithm.fromName(name));
    }

    private void registerHandler(RateLimitAlgorithmHandler handler) {
        handlers.put(handler.algorithm(), handler);
        LOG.debugv("Registered algorithm handler: {0}", handler.algorithm());
    }
}
