package turnstile.core.model.ratelimit;

/**
 * The rate limit store could not answer, including timeouts.
 */
public class RateLimitUnavailableException extends RuntimeException {

    public RateLimitUnavailableException(String message) {
        super(message);
    }

    public RateLimitUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
