package turnstile.core.model.permission;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Actions on a resource.
 *
 * <p>{@link #WRITE} is an alias: it is satisfied by {@link #CREATE}, {@link #UPDATE} or
 * {@link #MANAGE} on the same resource.
 */
public enum Permission {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    LIST,
    SEARCH,
    EXPORT,
    IMPORT,
    MANAGE,
    CONFIGURE,
    MONITOR,
    EXECUTE,
    DEPLOY,
    DEBUG,
    WRITE;

    private static final Set<Permission> WRITE_EQUIVALENTS = EnumSet.of(CREATE, UPDATE, MANAGE);

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAlias() {
        return this == WRITE;
    }

    /**
     * Concrete permissions that satisfy this one.
     *
     * @return {@code {CREATE, UPDATE, MANAGE}} for WRITE, otherwise just this permission
     */
    public Set<Permission> satisfiedBy() {
        return this == WRITE ? WRITE_EQUIVALENTS : EnumSet.of(this);
    }

    /**
     * Parse a permission from its lowercase name.
     *
     * @param value e.g. "export"
     * @return the permission
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Permission fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Permission cannot be null or blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
