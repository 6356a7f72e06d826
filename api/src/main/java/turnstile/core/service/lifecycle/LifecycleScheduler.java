package turnstile.core.service.lifecycle;

import java.time.Clock;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.config.LifecycleConfig;
import turnstile.core.port.in.KeyLifecycleManagement;

/**
 * Drives periodic lifecycle passes.
 *
 * <p>The scheduler ticks at the retry delay. A tick only runs a pass once the previous outcome
 * allows it: the check interval after a successful pass, the retry delay after a failed or
 * timed-out one. Overlapping ticks are skipped.
 */
@ApplicationScoped
public class LifecycleScheduler {

    private static final Logger LOG = Logger.getLogger(LifecycleScheduler.class);

    private final KeyLifecycleManagement lifecycle;
    private final LifecycleConfig config;
    private final Clock clock;

    private volatile Instant nextRunAt = Instant.MIN;

    @Inject
    public LifecycleScheduler(KeyLifecycleManagement lifecycle, LifecycleConfig config, Clock clock) {
        this.lifecycle = lifecycle;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Run a lifecycle pass if one is due.
     *
     * @return completes once the pass (if any) has finished; never fails
     */
    @Scheduled(
            identity = "key-lifecycle",
            every = "${turnstile.lifecycle.retry-delay:PT1M}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> processKeyLifecycle() {
        if (!config.enabled()) {
            return Uni.createFrom().voidItem();
        }
        final var now = clock.instant();
        if (now.isBefore(nextRunAt)) {
            return Uni.createFrom().voidItem();
        }

        return lifecycle
                .runCycle()
                .ifNoItem()
                .after(config.cycleTimeout())
                .failWith(() -> new LifecycleCycleTimeoutException(config.cycleTimeout()))
                .invoke(result -> {
                    nextRunAt = clock.instant().plus(config.checkInterval());
                    LOG.debugv(
                            "Lifecycle pass complete: notices={0}, expired={1}, rotations={2}",
                            result.notices().size(),
                            result.expiredKeyIds().size(),
                            result.rotations().size());
                })
                .replaceWithVoid()
                .onFailure()
                .recoverWithUni(error -> {
                    nextRunAt = clock.instant().plus(config.retryDelay());
                    LOG.errorv(error, "Lifecycle pass failed, retrying in {0}", config.retryDelay());
                    return Uni.createFrom().voidItem();
                });
    }

    /**
     * Earliest instant at which the next tick runs a pass.
     */
    public Instant nextRunAt() {
        return nextRunAt;
    }
}
