package turnstile.core.model.ratelimit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FixedWindowAlgorithm")
class FixedWindowAlgorithmTest {

    private static final long WINDOW_START = 1_700_000_040_000L; // aligned to a 60s window
    private final FixedWindowAlgorithm algorithm = FixedWindowAlgorithm.getInstance();
    private final EffectiveRateLimit limit = new EffectiveRateLimit(3, 60);

    @Nested
    @DisplayName("Within a window")
    class WithinWindow {

        @Test
        @DisplayName("should count down remaining requests")
        void shouldCountDownRemaining() {
            RateLimitState state = null;
            for (long expected = 2; expected >= 0; expected--) {
                var evaluation = algorithm.evaluate(state, limit, 1, WINDOW_START + 1_000);
                assertTrue(evaluation.decision().allowed());
                assertEquals(expected, evaluation.decision().remaining());
                state = evaluation.newState();
            }
        }

        @Test
        @DisplayName("should reject without charging the rejected request")
        void shouldRejectWithoutCharging() {
            RateLimitState state = new WindowCounterState(WINDOW_START, 3);

            var evaluation = algorithm.evaluate(state, limit, 1, WINDOW_START + 45_000);

            assertFalse(evaluation.decision().allowed());
            assertEquals(0, evaluation.decision().remaining());
            assertEquals(15, evaluation.decision().retryAfterSeconds().getAsLong());
            assertSame(state, evaluation.newState());
        }

        @Test
        @DisplayName("should reset at the end of the window")
        void shouldReportWindowEndAsReset() {
            var evaluation = algorithm.evaluate(null, limit, 1, WINDOW_START + 10_000);

            assertEquals(WINDOW_START + 60_000, evaluation.decision().resetAt().toEpochMilli());
            assertEquals(WINDOW_START + 60_000, evaluation.expiresAtMillis());
        }

        @Test
        @DisplayName("should not change state on a zero-cost peek")
        void shouldNotChangeStateOnPeek() {
            RateLimitState state = new WindowCounterState(WINDOW_START, 2);

            var evaluation = algorithm.evaluate(state, limit, 0, WINDOW_START + 1_000);

            assertTrue(evaluation.decision().allowed());
            assertEquals(1, evaluation.decision().remaining());
            assertSame(state, evaluation.newState());
        }
    }

    @Nested
    @DisplayName("Window boundaries")
    class Boundaries {

        @Test
        @DisplayName("should start a fresh count in the next window")
        void shouldStartFreshInNextWindow() {
            RateLimitState state = new WindowCounterState(WINDOW_START, 3);

            var evaluation = algorithm.evaluate(state, limit, 1, WINDOW_START + 60_000);

            assertTrue(evaluation.decision().allowed());
            assertEquals(2, evaluation.decision().remaining());
        }

        @Test
        @DisplayName("should store each window under its own key")
        void shouldUseWindowScopedStorageKey() {
            var first = algorithm.storageKey("key:1", limit, WINDOW_START + 59_999);
            var second = algorithm.storageKey("key:1", limit, WINDOW_START + 60_000);

            assertTrue(first.startsWith("key:1:"));
            assertNotEquals(first, second);
        }
    }

    @Test
    @DisplayName("should reject every request when the limit is zero")
    void shouldRejectWhenLimitIsZero() {
        var evaluation = algorithm.evaluate(null, new EffectiveRateLimit(0, 60), 1, WINDOW_START);

        assertFalse(evaluation.decision().allowed());
        assertEquals("fixed_window", evaluation.decision().algorithm());
    }
}
