package turnstile.core.model.auth;

/**
 * Freshly generated key material.
 *
 * <p>The secret exists only in this value and in the token handed to the client once;
 * only the digest is persisted.
 *
 * @param keyId  public identifier (e.g. {@code ak_...}), stored in plaintext and indexed
 * @param secret private secret (e.g. {@code sk_...}), never stored
 * @param digest keyed one-way digest of the secret
 */
public record KeyMaterial(String keyId, String secret, String digest) {

    public KeyMaterial {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key id cannot be null or blank");
        }
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Secret cannot be null or blank");
        }
        if (digest == null || digest.isBlank()) {
            throw new IllegalArgumentException("Digest cannot be null or blank");
        }
    }

    /**
     * Render the credential presented by clients: {@code <keyId>.<secret>}.
     *
     * @return the presented API key
     */
    public String presentedKey() {
        return keyId + PresentedCredential.SEPARATOR + secret;
    }

    @Override
    public String toString() {
        return "KeyMaterial[keyId=" + keyId + ", secret=[REDACTED], digest=[REDACTED]]";
    }
}
