package turnstile.core.model.lifecycle;

import java.util.List;

/**
 * What one pass of the lifecycle loop did.
 *
 * @param notices       expiration notices raised
 * @param expiredKeyIds record ids flipped to expired
 * @param rotations     scheduled rotations performed
 */
public record LifecycleCycleResult(
        List<ExpirationNotice> notices, List<String> expiredKeyIds, List<RotationResult> rotations) {

    public LifecycleCycleResult {
        notices = notices == null ? List.of() : List.copyOf(notices);
        expiredKeyIds = expiredKeyIds == null ? List.of() : List.copyOf(expiredKeyIds);
        rotations = rotations == null ? List.of() : List.copyOf(rotations);
    }
}
