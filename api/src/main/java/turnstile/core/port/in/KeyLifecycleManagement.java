package turnstile.core.port.in;

import java.time.Duration;
import java.util.List;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.lifecycle.ExpirationNotice;
import turnstile.core.model.lifecycle.LifecycleCycleResult;
import turnstile.core.model.lifecycle.LifecycleReport;
import turnstile.core.model.lifecycle.RotationResult;
import turnstile.core.model.lifecycle.RotationTrigger;

/**
 * Primary port for out-of-band key lifecycle operations.
 */
public interface KeyLifecycleManagement {

    /**
     * Flip keys whose expiry has passed to expired.
     *
     * @return Uni with the record ids that were expired
     */
    Uni<List<String>> expireOldKeys();

    /**
     * Find active keys expiring within the notification window and notify their owners.
     *
     * @return Uni with the notices raised
     */
    Uni<List<ExpirationNotice>> checkExpiringKeys();

    /**
     * Rotate a key using the trigger's default transition period.
     *
     * @param apiKeyId record id of the key to rotate
     * @param trigger  what caused the rotation
     * @return Uni with the result; never fails
     */
    Uni<RotationResult> rotate(String apiKeyId, RotationTrigger trigger);

    /**
     * Rotate a key with an explicit transition period.
     *
     * @param apiKeyId         record id of the key to rotate
     * @param trigger          what caused the rotation
     * @param transitionPeriod transition period, ignored for immediate triggers
     * @return Uni with the result; never fails
     */
    Uni<RotationResult> rotate(String apiKeyId, RotationTrigger trigger, Duration transitionPeriod);

    /**
     * Schedule automatic rotation.
     *
     * @param apiKeyId record id
     * @param interval time between rotations, or null for the configured default
     * @return Uni with true if the key exists and was scheduled
     */
    Uni<Boolean> scheduleAutoRotation(String apiKeyId, Duration interval);

    /**
     * Rotate every key whose scheduled rotation is due.
     *
     * @return Uni with one result per due key
     */
    Uni<List<RotationResult>> processScheduledRotations();

    /**
     * Describe where a key stands in its lifecycle.
     *
     * @param apiKeyId record id
     * @return Uni with the report, or a failure with IllegalArgumentException if unknown
     */
    Uni<LifecycleReport> lifecycleStatus(String apiKeyId);

    /**
     * One pass of the background loop: notices, expiry, scheduled rotations.
     *
     * @return Uni with what the pass did
     */
    Uni<LifecycleCycleResult> runCycle();
}
