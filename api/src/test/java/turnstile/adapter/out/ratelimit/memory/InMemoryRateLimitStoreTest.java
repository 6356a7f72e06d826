package turnstile.adapter.out.ratelimit.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turnstile.core.model.ratelimit.EffectiveRateLimit;
import turnstile.core.model.ratelimit.FixedWindowAlgorithm;
import turnstile.core.model.ratelimit.SlidingWindowAlgorithm;
import turnstile.core.model.ratelimit.TokenBucketAlgorithm;
import turnstile.testing.MutableClock;

@DisplayName("InMemoryRateLimitStore")
class InMemoryRateLimitStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private MutableClock clock;
    private InMemoryRateLimitStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-01-01T00:00:00Z");
        store = new InMemoryRateLimitStore(clock, Duration.ofMinutes(5));
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        @Test
        @DisplayName("should keep state between checks")
        void shouldKeepStateBetweenChecks() {
            var limit = new EffectiveRateLimit(3, 60);
            var handler = SlidingWindowAlgorithm.getInstance();

            for (long expected = 2; expected >= 0; expected--) {
                var decision = store.evaluate(handler, "key:a", limit, 1).await().atMost(TIMEOUT);
                assertTrue(decision.allowed());
                assertEquals(expected, decision.remaining());
            }
            var rejected = store.evaluate(handler, "key:a", limit, 1).await().atMost(TIMEOUT);

            assertFalse(rejected.allowed());
        }

        @Test
        @DisplayName("should track keys independently")
        void shouldTrackKeysIndependently() {
            var limit = new EffectiveRateLimit(1, 60);
            var handler = TokenBucketAlgorithm.getInstance();

            store.evaluate(handler, "key:a", limit, 1).await().atMost(TIMEOUT);
            var other = store.evaluate(handler, "key:b", limit, 1).await().atMost(TIMEOUT);

            assertTrue(other.allowed());
        }

        @Test
        @DisplayName("should not store anything for a zero-cost peek")
        void shouldNotStoreOnPeek() {
            var decision = store.evaluate(FixedWindowAlgorithm.getInstance(), "key:a", new EffectiveRateLimit(5, 60), 0)
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(5, decision.remaining());
            assertEquals(0, store.size());
        }

        @Test
        @DisplayName("should ignore expired state")
        void shouldIgnoreExpiredState() {
            var limit = new EffectiveRateLimit(1, 60);
            var handler = SlidingWindowAlgorithm.getInstance();
            store.evaluate(handler, "key:a", limit, 1).await().atMost(TIMEOUT);

            clock.advance(Duration.ofSeconds(61));
            var decision = store.evaluate(handler, "key:a", limit, 1).await().atMost(TIMEOUT);

            assertTrue(decision.allowed());
        }

        @Test
        @DisplayName("should admit exactly the limit under concurrent checks")
        void shouldAdmitExactlyLimitUnderConcurrency() throws InterruptedException {
            var threads = 32;
            var limit = new EffectiveRateLimit(threads - 1, 60);
            var handler = SlidingWindowAlgorithm.getInstance();
            var allowed = new AtomicInteger();
            var start = new CountDownLatch(1);
            var done = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);

            try {
                for (var i = 0; i < threads; i++) {
                    executor.submit(() -> {
                        try {
                            start.await();
                            var decision = store.evaluate(handler, "key:shared", limit, 1)
                                    .await()
                                    .atMost(TIMEOUT);
                            if (decision.allowed()) {
                                allowed.incrementAndGet();
                            }
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            done.countDown();
                        }
                    });
                }
                start.countDown();
                assertTrue(done.await(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(threads - 1, allowed.get());
        }
    }

    @Nested
    @DisplayName("Counters")
    class Counters {

        @Test
        @DisplayName("should increment and read a counter")
        void shouldIncrementAndRead() {
            store.increment("activity:x", 1, Duration.ofMinutes(10)).await().atMost(TIMEOUT);
            var value = store.increment("activity:x", 2, Duration.ofMinutes(10)).await().atMost(TIMEOUT);

            assertEquals(3, value);
            assertEquals(3, store.get("activity:x").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should keep the TTL set when the counter was created")
        void shouldKeepCreationTtl() {
            store.increment("activity:x", 1, Duration.ofMinutes(10)).await().atMost(TIMEOUT);
            clock.advance(Duration.ofMinutes(6));
            store.increment("activity:x", 1, Duration.ofMinutes(10)).await().atMost(TIMEOUT);
            clock.advance(Duration.ofMinutes(5));

            assertEquals(0, store.get("activity:x").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should extend an existing entry with expire")
        void shouldExtendWithExpire() {
            store.increment("activity:x", 1, Duration.ofMinutes(1)).await().atMost(TIMEOUT);

            assertTrue(store.expire("activity:x", Duration.ofMinutes(30)).await().atMost(TIMEOUT));
            clock.advance(Duration.ofMinutes(10));

            assertEquals(1, store.get("activity:x").await().atMost(TIMEOUT));
            assertFalse(store.expire("activity:missing", Duration.ofMinutes(1)).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should read zero for a missing counter")
        void shouldReadZeroWhenMissing() {
            assertEquals(0, store.get("activity:missing").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("reset")
    class Reset {

        @Test
        @DisplayName("should remove a key and its derived keys")
        void shouldRemoveDerivedKeys() {
            var limit = new EffectiveRateLimit(1, 60);
            store.evaluate(FixedWindowAlgorithm.getInstance(), "key:a", limit, 1).await().atMost(TIMEOUT);
            store.evaluate(SlidingWindowAlgorithm.getInstance(), "key:a:/api/v1/data", limit, 1)
                    .await()
                    .atMost(TIMEOUT);
            store.evaluate(SlidingWindowAlgorithm.getInstance(), "key:ab", limit, 1).await().atMost(TIMEOUT);

            assertTrue(store.reset("key:a").await().atMost(TIMEOUT));

            assertEquals(1, store.size());
            var decision = store.evaluate(FixedWindowAlgorithm.getInstance(), "key:a", limit, 1)
                    .await()
                    .atMost(TIMEOUT);
            assertTrue(decision.allowed());
        }

        @Test
        @DisplayName("should report false when nothing was stored")
        void shouldReportFalseWhenEmpty() {
            assertFalse(store.reset("key:none").await().atMost(TIMEOUT));
        }
    }

    @Test
    @DisplayName("should sweep expired entries once the cleanup interval has passed")
    void shouldSweepExpiredEntries() {
        store.increment("activity:old", 1, Duration.ofMinutes(1)).await().atMost(TIMEOUT);
        assertEquals(1, store.size());

        clock.advance(Duration.ofMinutes(6));
        store.increment("activity:new", 1, Duration.ofMinutes(1)).await().atMost(TIMEOUT);

        assertEquals(1, store.size());
    }
}
