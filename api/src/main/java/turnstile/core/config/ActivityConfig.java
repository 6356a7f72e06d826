package turnstile.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Configuration for activity event recording.
 *
 * <p>Configuration prefix: {@code turnstile.activity}
 */
@ConfigMapping(prefix = "turnstile.activity")
public interface ActivityConfig {

    @WithDefault("true")
    boolean enabled();

    /**
     * Number of repeated failures from one source within the window after which
     * events are escalated one severity level.
     *
     * @return threshold (default: 5)
     */
    @WithName("repeat-threshold")
    @WithDefault("5")
    long repeatThreshold();

    /**
     * Window over which repeated failures are counted.
     *
     * @return window (default: 10 minutes)
     */
    @WithName("repeat-window")
    @WithDefault("PT10M")
    Duration repeatWindow();
}
