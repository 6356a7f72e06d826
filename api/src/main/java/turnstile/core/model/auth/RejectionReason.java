package turnstile.core.model.auth;

/**
 * Why an authentication attempt was rejected.
 *
 * <p>{@link #KEY_NOT_FOUND} deliberately covers both an unknown key id and a wrong secret.
 * Messages are safe to return to clients.
 */
public enum RejectionReason {
    NO_KEY_PRESENTED(401, "no_key_presented", "API key required"),
    MALFORMED_CREDENTIAL(401, "malformed_credential", "Invalid API key format"),
    KEY_NOT_FOUND(401, "key_not_found", "Invalid API key"),
    EXPIRED(401, "expired", "API key has expired"),
    REVOKED(401, "revoked", "API key has been revoked"),
    SUSPENDED(403, "suspended", "API key is suspended"),
    IP_REJECTED(403, "ip_rejected", "Request IP address is not allowed for this API key"),
    DOMAIN_REJECTED(403, "domain_rejected", "Request origin is not allowed for this API key");

    private final int statusCode;
    private final String code;
    private final String message;

    RejectionReason(int statusCode, String code, String message) {
        this.statusCode = statusCode;
        this.code = code;
        this.message = message;
    }

    /**
     * HTTP status the caller should answer with.
     *
     * @return 401 for credential problems, 403 for policy rejections
     */
    public int statusCode() {
        return statusCode;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }
}
