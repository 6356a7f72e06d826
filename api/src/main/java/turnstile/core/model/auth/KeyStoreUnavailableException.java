package turnstile.core.model.auth;

/**
 * The API key record store could not be reached in time.
 *
 * <p>Distinct from an authentication rejection: the credential was never judged.
 */
public class KeyStoreUnavailableException extends RuntimeException {

    public KeyStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
