package turnstile.core.model.auth;

/**
 * Terminal result of one pass through the authentication gate.
 */
public sealed interface AuthenticationOutcome {

    boolean valid();

    /**
     * The presented key is valid.
     *
     * @param apiKey     the matched record, used downstream by rate limiting and permissions
     * @param deprecated true when the key is the old half of a rotation still in its transition period
     */
    record Valid(ApiKeyRecord apiKey, boolean deprecated) implements AuthenticationOutcome {

        public Valid {
            if (apiKey == null) {
                throw new IllegalArgumentException("apiKey cannot be null");
            }
        }

        @Override
        public boolean valid() {
            return true;
        }
    }

    /**
     * The presented key was rejected.
     *
     * @param reason the rejection reason
     * @param keyId  the presented key id when one could be parsed (may be null)
     */
    record Rejected(RejectionReason reason, String keyId) implements AuthenticationOutcome {

        public Rejected {
            if (reason == null) {
                throw new IllegalArgumentException("reason cannot be null");
            }
        }

        @Override
        public boolean valid() {
            return false;
        }

        public int statusCode() {
            return reason.statusCode();
        }
    }

    static AuthenticationOutcome valid(ApiKeyRecord apiKey) {
        return new Valid(apiKey, false);
    }

    static AuthenticationOutcome deprecated(ApiKeyRecord apiKey) {
        return new Valid(apiKey, true);
    }

    static AuthenticationOutcome rejected(RejectionReason reason, String keyId) {
        return new Rejected(reason, keyId);
    }
}
