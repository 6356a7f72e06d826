package turnstile.core.model.permission;

import java.util.List;
import java.util.Set;

/**
 * Description of a scope for diagnostic responses.
 *
 * @param name                 scope name
 * @param description          description
 * @param inherits             inherited scope names
 * @param directPermissions    directly granted permissions
 * @param effectivePermissions permissions granted including inheritance
 */
public record ScopeInfo(
        String name,
        String description,
        List<String> inherits,
        List<String> directPermissions,
        Set<String> effectivePermissions) {}
