package turnstile.core.service.permission;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import turnstile.core.model.permission.Permission;
import turnstile.core.model.permission.Resource;
import turnstile.core.model.permission.ResourcePermission;
import turnstile.core.model.permission.ScopeCatalog;
import turnstile.core.model.permission.ScopeDefinition;
import turnstile.core.model.permission.ScopeInfo;

/**
 * Maps granted scopes to resource permissions.
 *
 * <p>Scopes are either catalog names ({@code read}, {@code write}, {@code admin}, ...) or
 * resource-qualified strings ({@code user:read}) granting exactly one pair. Catalog scopes
 * include the permissions of the scopes they inherit. {@code admin} grants every permission
 * on every resource. Unknown scope strings and null entries grant nothing.
 *
 * <p>No I/O. Effective permission sets are memoized per distinct scope set.
 */
@ApplicationScoped
public class PermissionEvaluator {

    static final long CACHE_MAX_SIZE = 512;

    private static final Set<ResourcePermission> ALL_PERMISSIONS = allPermissions();

    private final Cache<Set<String>, Set<ResourcePermission>> effectiveCache;

    public PermissionEvaluator() {
        this.effectiveCache = Caffeine.newBuilder().maximumSize(CACHE_MAX_SIZE).build();
    }

    /**
     * Check whether the scopes grant a permission on a resource.
     *
     * <p>{@link Permission#WRITE} is satisfied by create, update or manage.
     *
     * @param scopes     granted scopes (may be empty)
     * @param resource   the resource
     * @param permission the required permission
     * @return true if granted
     */
    public boolean hasPermission(Collection<String> scopes, Resource resource, Permission permission) {
        final var granted = grants(scopes);
        if (granted.contains(ResourcePermission.of(resource, permission))) {
            return true;
        }
        return permission.satisfiedBy().stream()
                .anyMatch(equivalent -> granted.contains(ResourcePermission.of(resource, equivalent)));
    }

    public boolean hasPermission(Collection<String> scopes, ResourcePermission required) {
        return hasPermission(scopes, required.resource(), required.permission());
    }

    public boolean hasAnyPermission(Collection<String> scopes, Resource resource, Collection<Permission> permissions) {
        return permissions.stream().anyMatch(permission -> hasPermission(scopes, resource, permission));
    }

    /**
     * Effective permissions as sorted {@code resource:permission} strings.
     *
     * @param scopes granted scopes
     * @return the permission strings
     */
    public Set<String> effectivePermissions(Collection<String> scopes) {
        return render(grants(scopes));
    }

    public Set<Permission> resourcePermissions(Collection<String> scopes, Resource resource) {
        final var permissions = EnumSet.noneOf(Permission.class);
        for (final var granted : grants(scopes)) {
            if (granted.resource() == resource) {
                permissions.add(granted.permission());
            }
        }
        return permissions;
    }

    /**
     * Report which scopes are recognized, in input order.
     *
     * @param scopes scope names
     * @return scope to validity
     */
    public Map<String, Boolean> validateScopes(List<String> scopes) {
        final var results = new LinkedHashMap<String, Boolean>();
        for (final var scope : scopes) {
            if (scope != null) {
                results.put(scope, ScopeCatalog.isKnown(scope) || parseQualified(scope).isPresent());
            }
        }
        return results;
    }

    public Optional<ScopeInfo> scopeInfo(String name) {
        return ScopeCatalog.find(name).map(definition -> new ScopeInfo(
                definition.name(),
                definition.description(),
                definition.inherits(),
                definition.permissions().stream().map(ResourcePermission::toString).toList(),
                effectivePermissions(List.of(definition.name()))));
    }

    public Map<String, ScopeInfo> allScopeInfo() {
        final var all = new LinkedHashMap<String, ScopeInfo>();
        for (final var definition : ScopeCatalog.all()) {
            scopeInfo(definition.name()).ifPresent(info -> all.put(definition.name(), info));
        }
        return all;
    }

    /**
     * Catalog scopes that on their own cover all required permissions, narrowest first.
     *
     * @param requiredPermissions {@code resource:permission} strings
     * @return matching scope names
     * @throws IllegalArgumentException if a permission string is malformed
     */
    public List<String> suggestScopes(Collection<String> requiredPermissions) {
        final var required = requiredPermissions.stream().map(ResourcePermission::parse).toList();
        return ScopeCatalog.all().stream()
                .map(ScopeDefinition::name)
                .filter(scope -> required.stream().allMatch(permission -> hasPermission(List.of(scope), permission)))
                .sorted(Comparator.comparingInt(scope -> grants(List.of(scope)).size()))
                .toList();
    }

    /**
     * Warnings for scopes made redundant by another granted scope that inherits them.
     *
     * @param scopes granted scopes
     * @return human-readable warnings
     */
    public List<String> scopeConflicts(List<String> scopes) {
        final var warnings = new ArrayList<String>();
        for (var i = 0; i < scopes.size(); i++) {
            if (scopes.get(i) == null) {
                continue;
            }
            final var definition = ScopeCatalog.find(scopes.get(i));
            if (definition.isEmpty()) {
                continue;
            }
            for (var j = 0; j < scopes.size(); j++) {
                final var other = scopes.get(j);
                if (i != j && other != null && definition.get().inherits().contains(other)) {
                    warnings.add("Scope '" + definition.get().name() + "' already includes '" + other + "' - '"
                            + other + "' is redundant");
                }
            }
        }
        return warnings;
    }

    private Set<ResourcePermission> grants(Collection<String> scopes) {
        if (scopes == null || scopes.isEmpty()) {
            return Set.of();
        }
        final var key = scopes.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableSet());
        if (key.isEmpty()) {
            return Set.of();
        }
        return effectiveCache.get(key, PermissionEvaluator::collect);
    }

    long cachedScopeSets() {
        effectiveCache.cleanUp();
        return effectiveCache.estimatedSize();
    }

    private static Set<ResourcePermission> collect(Set<String> scopes) {
        final var granted = new HashSet<ResourcePermission>();
        final var visited = new HashSet<String>();
        for (final var scope : scopes) {
            collectScope(scope, granted, visited);
        }
        return Collections.unmodifiableSet(granted);
    }

    private static void collectScope(String scope, Set<ResourcePermission> granted, Set<String> visited) {
        if (!visited.add(scope)) {
            return;
        }
        final var definition = ScopeCatalog.find(scope);
        if (definition.isEmpty()) {
            parseQualified(scope).ifPresent(granted::add);
            return;
        }
        if (definition.get().universal()) {
            granted.addAll(ALL_PERMISSIONS);
        }
        granted.addAll(definition.get().permissions());
        for (final var inherited : definition.get().inherits()) {
            collectScope(inherited, granted, visited);
        }
    }

    private static Optional<ResourcePermission> parseQualified(String scope) {
        if (scope == null || scope.indexOf(':') < 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(ResourcePermission.parse(scope));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static Set<String> render(Set<ResourcePermission> permissions) {
        return permissions.stream()
                .map(ResourcePermission::toString)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static Set<ResourcePermission> allPermissions() {
        final var all = new HashSet<ResourcePermission>();
        for (final var resource : Resource.values()) {
            for (final var permission : Permission.values()) {
                if (!permission.isAlias()) {
                    all.add(ResourcePermission.of(resource, permission));
                }
            }
        }
        return Collections.unmodifiableSet(all);
    }
}
