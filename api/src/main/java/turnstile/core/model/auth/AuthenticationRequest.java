package turnstile.core.model.auth;

import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-request input to the authentication gate.
 *
 * @param presentedKey the raw presented credential (may be null when none was sent)
 * @param sourceIp     the requester IP address
 * @param requestPath  the request path
 * @param originHost   host of the {@code Origin}/{@code Referer} header (may be null)
 */
public record AuthenticationRequest(String presentedKey, String sourceIp, String requestPath, String originHost) {

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "bearer ";

    public AuthenticationRequest {
        if (requestPath == null || requestPath.isBlank()) {
            requestPath = "/";
        }
        if (originHost != null) {
            originHost = originHost.toLowerCase(Locale.ROOT);
        }
    }

    public static AuthenticationRequest of(String presentedKey, String sourceIp, String requestPath) {
        return new AuthenticationRequest(presentedKey, sourceIp, requestPath, null);
    }

    /**
     * Build a request from HTTP headers.
     *
     * <p>The credential is read from {@code X-API-Key}, falling back to
     * {@code Authorization: Bearer <token>}. The origin host is read from {@code Origin},
     * falling back to {@code Referer}.
     *
     * @param headers     request headers (names are matched case-insensitively)
     * @param sourceIp    the requester IP address
     * @param requestPath the request path
     * @return the authentication request
     */
    public static AuthenticationRequest fromHeaders(Map<String, String> headers, String sourceIp, String requestPath) {
        final var caseInsensitive = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            caseInsensitive.putAll(headers);
        }
        return new AuthenticationRequest(
                extractPresentedKey(caseInsensitive).orElse(null),
                sourceIp,
                requestPath,
                extractOriginHost(caseInsensitive).orElse(null));
    }

    public boolean hasPresentedKey() {
        return presentedKey != null && !presentedKey.isBlank();
    }

    private static Optional<String> extractPresentedKey(Map<String, String> headers) {
        final var apiKey = headers.get(API_KEY_HEADER);
        if (apiKey != null && !apiKey.isBlank()) {
            return Optional.of(apiKey.trim());
        }
        final var authorization = headers.get(AUTHORIZATION_HEADER);
        if (authorization != null && authorization.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            final var token = authorization.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        }
        return Optional.empty();
    }

    private static Optional<String> extractOriginHost(Map<String, String> headers) {
        final var origin = headers.get("Origin");
        final var source = origin != null && !origin.isBlank() ? origin : headers.get("Referer");
        if (source == null || source.isBlank() || "null".equals(source.trim())) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(URI.create(source.trim()).getHost());
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
