package turnstile.core.model.permission;

import java.util.List;

/**
 * A named scope, its direct grants and the scopes it inherits.
 *
 * @param name        scope name as granted to keys
 * @param description human-readable description
 * @param inherits    names of inherited scopes
 * @param permissions directly granted permissions
 * @param universal   whether the scope grants every permission on every resource
 */
public record ScopeDefinition(
        String name,
        String description,
        List<String> inherits,
        List<ResourcePermission> permissions,
        boolean universal) {

    public ScopeDefinition {
        inherits = inherits == null ? List.of() : List.copyOf(inherits);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }
}
