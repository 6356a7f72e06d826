package turnstile.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import turnstile.core.model.lifecycle.RotationTrigger;

/**
 * Configuration for key expiry, rotation and owner notifications.
 *
 * <p>Example configuration:
 * <pre>{@code
 * turnstile.lifecycle.enabled=true
 * turnstile.lifecycle.check-interval=PT1H
 * turnstile.lifecycle.notification-window=P30D
 * turnstile.lifecycle.transition.scheduled=P14D
 * }</pre>
 */
@ConfigMapping(prefix = "turnstile.lifecycle")
public interface LifecycleConfig {

    /**
     * Whether scheduled lifecycle passes run.
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Time between lifecycle passes.
     *
     * @return interval (default: 1 hour)
     */
    @WithName("check-interval")
    @WithDefault("PT1H")
    Duration checkInterval();

    /**
     * Delay before the next pass after a failed one.
     *
     * @return delay (default: 1 minute)
     */
    @WithName("retry-delay")
    @WithDefault("PT1M")
    Duration retryDelay();

    /**
     * Upper bound on a single pass. A pass that runs longer counts as failed.
     *
     * @return timeout (default: 10 minutes)
     */
    @WithName("cycle-timeout")
    @WithDefault("PT10M")
    Duration cycleTimeout();

    /**
     * How far ahead to look for expiring keys.
     *
     * @return window (default: 30 days)
     */
    @WithName("notification-window")
    @WithDefault("P30D")
    Duration notificationWindow();

    @WithName("warning-days")
    @WithDefault("30")
    int warningDays();

    @WithName("urgent-days")
    @WithDefault("7")
    int urgentDays();

    @WithName("critical-days")
    @WithDefault("1")
    int criticalDays();

    /**
     * Minimum validity left on a key produced by rotation, when the old key had an expiry.
     *
     * @return duration (default: 30 days)
     */
    @WithName("minimum-rotated-validity")
    @WithDefault("P30D")
    Duration minimumRotatedValidity();

    /**
     * Interval used when auto-rotation is scheduled without one.
     *
     * @return interval (default: 90 days)
     */
    @WithName("default-rotation-interval")
    @WithDefault("P90D")
    Duration defaultRotationInterval();

    TransitionConfig transition();

    /**
     * How long a rotated key keeps authenticating, per trigger.
     */
    interface TransitionConfig {

        @WithDefault("P14D")
        Duration manual();

        @WithDefault("P14D")
        Duration scheduled();

        @WithName("usage-anomaly")
        @WithDefault("P7D")
        Duration usageAnomaly();

        @WithName("expiration-approaching")
        @WithDefault("P30D")
        Duration expirationApproaching();

        @WithName("compliance-requirement")
        @WithDefault("P30D")
        Duration complianceRequirement();

        /**
         * Transition period for a trigger. Immediate triggers get none.
         *
         * @param trigger the rotation trigger
         * @return the transition period
         */
        default Duration forTrigger(RotationTrigger trigger) {
            return switch (trigger) {
                case SECURITY_INCIDENT -> Duration.ZERO;
                case MANUAL -> manual();
                case SCHEDULED -> scheduled();
                case USAGE_ANOMALY -> usageAnomaly();
                case EXPIRATION_APPROACHING -> expirationApproaching();
                case COMPLIANCE_REQUIREMENT -> complianceRequirement();
            };
        }
    }
}
