package turnstile.core.model.lifecycle;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of a rotation. Failures are reported here instead of being thrown.
 *
 * @param success            whether the rotation completed
 * @param oldKeyId           key id (or record id when the key was not found) of the rotated key
 * @param newKeyId           key id of the replacement (null on failure)
 * @param newPresentedKey    credential for the replacement, returned once (null on failure)
 * @param trigger            what caused the rotation
 * @param rotatedAt          when the rotation was attempted
 * @param transitionPeriod   how long the old key stays valid (zero when revoked immediately)
 * @param message            human-readable summary
 * @param errors             error messages (empty on success)
 */
public record RotationResult(
        boolean success,
        String oldKeyId,
        String newKeyId,
        String newPresentedKey,
        RotationTrigger trigger,
        Instant rotatedAt,
        Duration transitionPeriod,
        String message,
        List<String> errors) {

    public RotationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (transitionPeriod == null) {
            transitionPeriod = Duration.ZERO;
        }
    }

    public static RotationResult succeeded(
            String oldKeyId,
            String newKeyId,
            String newPresentedKey,
            RotationTrigger trigger,
            Instant rotatedAt,
            Duration transitionPeriod,
            String message) {
        return new RotationResult(
                true, oldKeyId, newKeyId, newPresentedKey, trigger, rotatedAt, transitionPeriod, message, List.of());
    }

    public static RotationResult failed(
            String oldKeyId, RotationTrigger trigger, Instant rotatedAt, String message, List<String> errors) {
        return new RotationResult(false, oldKeyId, null, null, trigger, rotatedAt, Duration.ZERO, message, errors);
    }

    public long transitionDays() {
        return transitionPeriod.toDays();
    }

    @Override
    public String toString() {
        return "RotationResult[success=" + success
                + ", oldKeyId=" + oldKeyId
                + ", newKeyId=" + newKeyId
                + ", trigger=" + trigger
                + ", rotatedAt=" + rotatedAt
                + ", transitionPeriod=" + transitionPeriod
                + ", message=" + message
                + ", errors=" + errors + "]";
    }
}
