package turnstile.adapter.out.ratelimit.memory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import turnstile.core.model.ratelimit.BucketState;
import turnstile.core.model.ratelimit.CounterState;
import turnstile.core.model.ratelimit.EffectiveRateLimit;
import turnstile.core.model.ratelimit.RateLimitAlgorithmHandler;
import turnstile.core.model.ratelimit.RateLimitDecision;
import turnstile.core.model.ratelimit.RateLimitState;
import turnstile.core.model.ratelimit.SlidingLogState;
import turnstile.core.model.ratelimit.SlidingWindowState;
import turnstile.core.model.ratelimit.WindowCounterState;
import turnstile.core.port.out.RateLimitStore;

/**
 * In-memory rate limit store.
 *
 * <p>
 * Stores state in a concurrent hash map; each key is read, evaluated and written inside
 * {@link ConcurrentMap#compute}, so concurrent checks on one key are serialized.
 *
 * <p>
 * Limitations:
 * <ul>
 * <li>State is not shared across instances</li>
 * <li>State is lost on restart</li>
 * </ul>
 *
 * <p>
 * Expired entries are ignored on read and swept from the map at most once per cleanup
 * interval, piggybacking on regular traffic.
 */
public final class InMemoryRateLimitStore implements RateLimitStore {

    private static final Logger LOG = Logger.getLogger(InMemoryRateLimitStore.class);

    static final String NAME = "memory";

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long cleanupIntervalMillis;
    private final AtomicLong lastSweepMillis;

    /**
     * Creates a new in-memory store.
     *
     * @param clock           time source for expiry
     * @param cleanupInterval minimum time between sweeps of expired entries
     */
    public InMemoryRateLimitStore(Clock clock, Duration cleanupInterval) {
        this.clock = clock;
        this.cleanupIntervalMillis = cleanupInterval.toMillis();
        this.lastSweepMillis = new AtomicLong(clock.millis());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Uni<RateLimitDecision> evaluate(
            RateLimitAlgorithmHandler handler, String key, EffectiveRateLimit limit, long cost) {
        return Uni.createFrom().item(() -> evaluateNow(handler, key, limit, cost));
    }

    private RateLimitDecision evaluateNow(
            RateLimitAlgorithmHandler handler, String key, EffectiveRateLimit limit, long cost) {
        final var nowMillis = clock.millis();
        sweepIfDue(nowMillis);

        final var storageKey = handler.storageKey(key, limit, nowMillis);
        final var decision = new AtomicReference<RateLimitDecision>();
        entries.compute(storageKey, (k, current) -> {
            final var live = current != null && current.isLive(nowMillis) ? current : null;
            final var state = live != null ? live.state() : null;
            final var evaluation = handler.evaluate(state, limit, cost, nowMillis);
            decision.set(evaluation.decision());

            final var newState = evaluation.newState();
            if (newState == null || newState == state) {
                return live;
            }
            return new Entry(newState, evaluation.expiresAtMillis());
        });
        return decision.get();
    }

    @Override
    public Uni<Long> increment(String key, long delta, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var nowMillis = clock.millis();
            sweepIfDue(nowMillis);
            final var updated = entries.compute(key, (k, current) -> {
                if (current != null && current.isLive(nowMillis) && current.state() instanceof CounterState counter) {
                    return new Entry(new CounterState(counter.value() + delta), current.expiresAtMillis());
                }
                return new Entry(new CounterState(delta), nowMillis + ttl.toMillis());
            });
            return ((CounterState) updated.state()).value();
        });
    }

    @Override
    public Uni<Long> get(String key) {
        return Uni.createFrom().item(() -> {
            final var entry = entries.get(key);
            if (entry == null || !entry.isLive(clock.millis())) {
                return 0L;
            }
            return usage(entry.state());
        });
    }

    @Override
    public Uni<Boolean> expire(String key, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var nowMillis = clock.millis();
            final var updated = entries.computeIfPresent(key, (k, current) -> current.isLive(nowMillis)
                    ? new Entry(current.state(), nowMillis + ttl.toMillis())
                    : null);
            return updated != null;
        });
    }

    @Override
    public Uni<Boolean> reset(String key) {
        return Uni.createFrom().item(() -> {
            final var derivedPrefix = key + ":";
            final var removedBase = entries.remove(key) != null;
            final var removedDerived = entries.keySet().removeIf(k -> k.startsWith(derivedPrefix));
            return removedBase || removedDerived;
        });
    }

    /**
     * Returns the number of entries currently held, including expired ones not yet swept.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Drop every entry. Called when the owning container shuts down.
     */
    public void shutdown() {
        entries.clear();
    }

    private void sweepIfDue(long nowMillis) {
        final var last = lastSweepMillis.get();
        if (nowMillis - last < cleanupIntervalMillis || !lastSweepMillis.compareAndSet(last, nowMillis)) {
            return;
        }
        final var before = entries.size();
        entries.values().removeIf(entry -> !entry.isLive(nowMillis));
        LOG.debugv("Swept {0} expired rate limit entries", before - entries.size());
    }

    private static long usage(RateLimitState state) {
        if (state instanceof CounterState counter) {
            return counter.value();
        }
        if (state instanceof WindowCounterState window) {
            return window.count();
        }
        if (state instanceof SlidingWindowState sliding) {
            return sliding.count();
        }
        if (state instanceof SlidingLogState log) {
            return log.totalCost();
        }
        if (state instanceof BucketState bucket) {
            return (long) Math.floor(bucket.tokens());
        }
        return 0L;
    }

    private record Entry(RateLimitState state, long expiresAtMillis) {

        boolean isLive(long nowMillis) {
            return expiresAtMillis > nowMillis;
        }
    }
}
