package turnstile.core.model.permission;

import static turnstile.core.model.permission.ResourcePermission.of;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed table of known scopes.
 */
public final class ScopeCatalog {

    public static final String READ = "read";
    public static final String WRITE = "write";
    public static final String ANALYTICS = "analytics";
    public static final String USER_MANAGEMENT = "user_management";
    public static final String API_MANAGEMENT = "api_management";
    public static final String ADMIN = "admin";

    private static final Map<String, ScopeDefinition> DEFINITIONS = buildDefinitions();

    private ScopeCatalog() {}

    public static Optional<ScopeDefinition> find(String name) {
        return Optional.ofNullable(DEFINITIONS.get(name));
    }

    public static boolean isKnown(String name) {
        return DEFINITIONS.containsKey(name);
    }

    /**
     * All scopes in declaration order, narrowest first.
     *
     * @return the scope definitions
     */
    public static Collection<ScopeDefinition> all() {
        return DEFINITIONS.values();
    }

    private static Map<String, ScopeDefinition> buildDefinitions() {
        final var definitions = new LinkedHashMap<String, ScopeDefinition>();
        register(definitions, new ScopeDefinition(
                READ,
                "Read-only access to basic resources",
                List.of(),
                List.of(of(Resource.USER, Permission.READ), of(Resource.API_KEY, Permission.READ)),
                false));
        register(definitions, new ScopeDefinition(
                WRITE,
                "Read and write access to basic resources",
                List.of(READ),
                List.of(
                        of(Resource.USER, Permission.UPDATE),
                        of(Resource.API_KEY, Permission.CREATE),
                        of(Resource.API_KEY, Permission.UPDATE)),
                false));
        register(definitions, new ScopeDefinition(
                ANALYTICS,
                "Access to usage analytics and reporting",
                List.of(READ),
                List.of(
                        of(Resource.ANALYTICS, Permission.READ),
                        of(Resource.ANALYTICS, Permission.LIST),
                        of(Resource.ANALYTICS, Permission.EXPORT),
                        of(Resource.API_KEY, Permission.MONITOR)),
                false));
        register(definitions, new ScopeDefinition(
                USER_MANAGEMENT,
                "Full user management capabilities",
                List.of(READ, WRITE),
                List.of(
                        of(Resource.USER, Permission.CREATE),
                        of(Resource.USER, Permission.DELETE),
                        of(Resource.USER, Permission.LIST),
                        of(Resource.USER, Permission.SEARCH),
                        of(Resource.USER, Permission.MANAGE)),
                false));
        register(definitions, new ScopeDefinition(
                API_MANAGEMENT,
                "Full API key management capabilities",
                List.of(READ, WRITE),
                List.of(
                        of(Resource.API_KEY, Permission.DELETE),
                        of(Resource.API_KEY, Permission.LIST),
                        of(Resource.API_KEY, Permission.SEARCH),
                        of(Resource.API_KEY, Permission.MANAGE),
                        of(Resource.API_KEY, Permission.CONFIGURE)),
                false));
        register(definitions, new ScopeDefinition(
                ADMIN,
                "Complete administrative access",
                List.of(READ, WRITE, ANALYTICS, USER_MANAGEMENT, API_MANAGEMENT),
                List.of(),
                true));
        return definitions;
    }

    private static void register(Map<String, ScopeDefinition> definitions, ScopeDefinition definition) {
        definitions.put(definition.name(), definition);
    }
}
