package turnstile.core.service.auth;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import turnstile.core.config.ApiKeyConfig;
import turnstile.core.model.auth.KeyMaterial;

/**
 * Generates API key material and computes and verifies secret digests.
 *
 * <p>Digests are HMAC-SHA256 over the secret, keyed with the server-side secret from
 * configuration. Secrets are never stored; only the digest is.
 */
@ApplicationScoped
public class KeyMaterialService {

    static final int MIN_HMAC_SECRET_LENGTH = 32;

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int KEY_ID_BYTES = 18;
    private static final int SECRET_BYTES = 32;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKeySpec hmacKey;
    private final String keyIdPrefix;
    private final String secretPrefix;

    @Inject
    public KeyMaterialService(ApiKeyConfig config) {
        this(config.hmacSecret(), config.keyIdPrefix(), config.secretPrefix());
    }

    KeyMaterialService(String hmacSecret, String keyIdPrefix, String secretPrefix) {
        if (hmacSecret == null || hmacSecret.length() < MIN_HMAC_SECRET_LENGTH) {
            throw new IllegalArgumentException(
                    "HMAC secret must be at least " + MIN_HMAC_SECRET_LENGTH + " characters");
        }
        this.hmacKey = new SecretKeySpec(hmacSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
        this.keyIdPrefix = keyIdPrefix;
        this.secretPrefix = secretPrefix;
    }

    /**
     * Generate a new key id and secret, and digest the secret.
     *
     * <p>The key id carries 24 random characters after its prefix and the secret 43.
     *
     * @return the new key material
     */
    public KeyMaterial generate() {
        final var keyId = keyIdPrefix + randomToken(KEY_ID_BYTES);
        final var secret = secretPrefix + randomToken(SECRET_BYTES);
        return new KeyMaterial(keyId, secret, hash(secret));
    }

    /**
     * Compute the digest of a secret.
     *
     * @param secret the secret
     * @return hex-encoded digest
     * @throws IllegalArgumentException if the secret is null or empty
     */
    public String hash(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret cannot be null or empty");
        }
        return HexFormat.of().formatHex(mac(secret));
    }

    /**
     * Check a secret against a stored digest in constant time.
     *
     * <p>Never throws: any malformed input simply fails verification.
     *
     * @param secret the presented secret
     * @param digest the stored digest
     * @return true only if the secret digests to {@code digest}
     */
    public boolean verify(String secret, String digest) {
        if (secret == null || secret.isEmpty() || digest == null || digest.isEmpty()) {
            return false;
        }
        final byte[] expected;
        try {
            expected = HexFormat.of().parseHex(digest);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(mac(secret), expected);
    }

    private byte[] mac(String secret) {
        try {
            final var mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(hmacKey);
            return mac.doFinal(secret.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new AssertionError("HmacSHA256 is required on every Java platform", e);
        }
    }

    private static String randomToken(int bytes) {
        final var buffer = new byte[bytes];
        SECURE_RANDOM.nextBytes(buffer);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer);
    }
}
