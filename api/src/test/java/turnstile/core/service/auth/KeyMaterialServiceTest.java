package turnstile.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import turnstile.core.model.auth.PresentedCredential;
import turnstile.testing.TestConfigs;

@DisplayName("KeyMaterialService")
class KeyMaterialServiceTest {

    private KeyMaterialService service;

    @BeforeEach
    void setUp() {
        service = new KeyMaterialService(TestConfigs.apiKeys());
    }

    @Nested
    @DisplayName("generate()")
    class Generate {

        @Test
        @DisplayName("should produce prefixed key id and secret of the documented length")
        void shouldProducePrefixedMaterial() {
            var material = service.generate();

            assertTrue(material.keyId().startsWith("ak_"));
            assertTrue(material.secret().startsWith("sk_"));
            assertEquals(3 + 24, material.keyId().length());
            assertEquals(3 + 43, material.secret().length());
            assertFalse(material.keyId().indexOf('.') >= 0);
        }

        @Test
        @DisplayName("should produce a digest that verifies the secret")
        void shouldProduceVerifiableDigest() {
            var material = service.generate();

            assertEquals(64, material.digest().length());
            assertTrue(service.verify(material.secret(), material.digest()));
        }

        @Test
        @DisplayName("should render a presented key that parses back to its parts")
        void shouldRenderPresentedKey() {
            var material = service.generate();

            var credential = PresentedCredential.parse(material.presentedKey()).orElseThrow();

            assertEquals(material.keyId(), credential.keyId());
            assertEquals(material.secret(), credential.secret());
        }

        @Test
        @DisplayName("should never repeat key ids")
        void shouldNotRepeat() {
            assertNotEquals(service.generate().keyId(), service.generate().keyId());
        }

        @Test
        @DisplayName("should keep the secret out of toString")
        void shouldRedactSecret() {
            var material = service.generate();

            assertFalse(material.toString().contains(material.secret()));
        }
    }

    @Nested
    @DisplayName("hash() and verify()")
    class HashAndVerify {

        @Test
        @DisplayName("should be deterministic for one server secret")
        void shouldBeDeterministic() {
            assertEquals(service.hash("sk_example"), service.hash("sk_example"));
        }

        @Test
        @DisplayName("should give distinct secrets distinct hashes")
        void shouldGiveDistinctSecretsDistinctHashes() {
            var secrets = new HashSet<String>();
            var hashes = new HashSet<String>();
            for (var i = 0; i < 500; i++) {
                var secret = service.generate().secret();
                secrets.add(secret);
                hashes.add(service.hash(secret));
            }

            assertEquals(500, secrets.size());
            assertEquals(secrets.size(), hashes.size());
            assertNotEquals(service.hash("sk_example"), service.hash("sk_examplf"));
        }

        @Test
        @DisplayName("should depend on the server secret")
        void shouldDependOnServerSecret() {
            var other = new KeyMaterialService("another-hmac-secret-with-32-chars-or-more", "ak_", "sk_");

            assertNotEquals(service.hash("sk_example"), other.hash("sk_example"));
            assertFalse(other.verify("sk_example", service.hash("sk_example")));
        }

        @Test
        @DisplayName("should reject a wrong secret")
        void shouldRejectWrongSecret() {
            var digest = service.hash("sk_right");

            assertFalse(service.verify("sk_wrong", digest));
        }

        @Test
        @DisplayName("should fail verification on malformed input instead of throwing")
        void shouldFailOnMalformedInput() {
            assertFalse(service.verify(null, service.hash("sk_x")));
            assertFalse(service.verify("", service.hash("sk_x")));
            assertFalse(service.verify("sk_x", null));
            assertFalse(service.verify("sk_x", "not-hex"));
            assertFalse(service.verify("sk_x", "abcd"));
        }

        @Test
        @DisplayName("should refuse to hash an empty secret")
        void shouldRefuseEmptySecret() {
            assertThrows(IllegalArgumentException.class, () -> service.hash(""));
        }
    }

    @Test
    @DisplayName("should refuse a short server secret")
    void shouldRefuseShortServerSecret() {
        var exception = assertThrows(
                IllegalArgumentException.class, () -> new KeyMaterialService("too-short", "ak_", "sk_"));

        assertTrue(exception.getMessage().contains("32"));
    }
}
