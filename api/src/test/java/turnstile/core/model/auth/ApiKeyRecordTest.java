package turnstile.core.model.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ApiKeyRecord")
class ApiKeyRecordTest {

    private static ApiKeyRecord.Builder builder() {
        return ApiKeyRecord.builder("rec-1", "ak_0123456789abcdef", "digest");
    }

    @Test
    @DisplayName("should leave createdAt unset unless the caller supplies it")
    void shouldNotInventCreationTime() {
        assertNull(builder().build().createdAt());

        var created = Instant.parse("2024-05-01T12:00:00Z");
        var record = builder().createdAt(created).build();

        assertEquals(created, record.createdAt());
        assertEquals(created, record.withStatus(ApiKeyStatus.SUSPENDED).createdAt());
    }

    @Test
    @DisplayName("should reject a null scope entry")
    void shouldRejectNullScope() {
        var scopes = new HashSet<>(Arrays.asList("read", null));

        var error = assertThrows(IllegalArgumentException.class, () -> builder().scopes(scopes).build());
        assertEquals("Scopes cannot contain null", error.getMessage());
    }

    @Test
    @DisplayName("should default missing collections to empty")
    void shouldDefaultCollections() {
        var record = builder().scopes(null).build();

        assertEquals(Set.of(), record.scopes());
        assertEquals(Set.of(), record.allowedIps());
        assertEquals(ApiKeyStatus.ACTIVE, record.status());
        assertEquals("ak_0123456789abcdef", record.name());
    }
}
