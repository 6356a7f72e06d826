package turnstile.adapter.out.ratelimit.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("RedisRateLimitStore")
class RedisRateLimitStoreTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(
            delimiter = '|',
            value = {
                "turnstile:ratelimit:key:1 | turnstile:ratelimit:key:1",
                "rl:user*                  | rl:user\\*",
                "rl:ip:[::1]               | rl:ip:\\[::1\\]",
                "rl:what?                  | rl:what\\?",
                "rl:back\\slash            | rl:back\\\\slash"
            })
    @DisplayName("should escape glob characters in the reset scan pattern")
    void shouldEscapeGlobCharactersInScanPattern(String key, String expected) {
        assertEquals(expected, RedisRateLimitStore.escapeGlob(key));
    }
}
