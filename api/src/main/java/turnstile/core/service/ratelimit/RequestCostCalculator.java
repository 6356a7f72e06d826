package turnstile.core.service.ratelimit;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Weighs a request for rate limiting by method and path.
 *
 * <p>Reads cost 1, or 2 under analytics and admin paths. Writes cost 3, 5 under admin
 * paths and 10 for bulk operations. Deletes cost 5.
 */
@ApplicationScoped
public class RequestCostCalculator {

    static final long DEFAULT_COST = 1;

    public long cost(String method, String path) {
        final var normalizedPath = path == null ? "" : path;
        final var normalizedMethod = method == null ? "GET" : method.toUpperCase(Locale.ROOT);
        return switch (normalizedMethod) {
            case "GET" -> normalizedPath.contains("/analytics/") || normalizedPath.contains("/admin/") ? 2 : 1;
            case "POST", "PUT", "PATCH" -> writeCost(normalizedPath);
            case "DELETE" -> 5;
            default -> DEFAULT_COST;
        };
    }

    private static long writeCost(String path) {
        if (path.endsWith("/bulk-operation")) {
            return 10;
        }
        return path.contains("/admin/") ? 5 : 3;
    }
}
