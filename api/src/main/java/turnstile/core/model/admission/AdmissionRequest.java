package turnstile.core.model.admission;

import java.util.Locale;
import java.util.Optional;

import turnstile.core.model.auth.AuthenticationRequest;
import turnstile.core.model.permission.ResourcePermission;

/**
 * An inbound request as seen by the admission pipeline.
 *
 * @param authentication     credential, source IP, path and origin
 * @param method             HTTP method
 * @param requiredPermission permission the target handler requires (null when none)
 */
public record AdmissionRequest(
        AuthenticationRequest authentication, String method, ResourcePermission requiredPermission) {

    public AdmissionRequest {
        if (authentication == null) {
            throw new IllegalArgumentException("authentication cannot be null");
        }
        method = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
    }

    public String path() {
        return authentication.requestPath();
    }

    public Optional<ResourcePermission> permission() {
        return Optional.ofNullable(requiredPermission);
    }
}
