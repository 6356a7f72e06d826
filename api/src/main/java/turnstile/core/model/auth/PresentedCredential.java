package turnstile.core.model.auth;

import java.util.Optional;

/**
 * A credential as presented by a client, split into its public key id and its secret.
 *
 * <p>Format: {@code <keyId>.<secret>}. The key id is the segment before the first dot,
 * so the record can be looked up without looking at the secret.
 *
 * @param keyId  public key identifier
 * @param secret the secret portion
 */
public record PresentedCredential(String keyId, String secret) {

    public static final char SEPARATOR = '.';

    /**
     * Split a presented token.
     *
     * @param token the raw presented token
     * @return the credential, or empty if the token is malformed
     */
    public static Optional<PresentedCredential> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        final var trimmed = token.trim();
        final var separator = trimmed.indexOf(SEPARATOR);
        if (separator <= 0 || separator == trimmed.length() - 1) {
            return Optional.empty();
        }
        final var keyId = trimmed.substring(0, separator);
        final var secret = trimmed.substring(separator + 1);
        if (keyId.isBlank() || secret.isBlank() || containsWhitespace(trimmed)) {
            return Optional.empty();
        }
        return Optional.of(new PresentedCredential(keyId, secret));
    }

    private static boolean containsWhitespace(String value) {
        for (var i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "PresentedCredential[keyId=" + keyId + ", secret=[REDACTED]]";
    }
}
