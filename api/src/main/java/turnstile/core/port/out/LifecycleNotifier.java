package turnstile.core.port.out;

import turnstile.core.model.auth.ApiKeyRecord;
import turnstile.core.model.lifecycle.ExpirationNotice;
import turnstile.core.model.lifecycle.RotationResult;

/**
 * Outbound notifications to key owners (e-mail or similar).
 */
public interface LifecycleNotifier {

    /**
     * Notify the owner that a key is about to expire or has expired.
     *
     * @param notice the notice
     */
    void expiring(ExpirationNotice notice);

    /**
     * Notify the owner that a key was rotated.
     *
     * @param rotatedKey the key that was replaced
     * @param result     the rotation result
     */
    void rotated(ApiKeyRecord rotatedKey, RotationResult result);
}
