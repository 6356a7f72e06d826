package turnstile.core.model.permission;

/**
 * A permission on a resource, rendered as {@code resource:permission}.
 *
 * @param resource   the resource
 * @param permission the permission
 */
public record ResourcePermission(Resource resource, Permission permission) {

    public ResourcePermission {
        if (resource == null || permission == null) {
            throw new IllegalArgumentException("resource and permission are required");
        }
    }

    public static ResourcePermission of(Resource resource, Permission permission) {
        return new ResourcePermission(resource, permission);
    }

    /**
     * Parse {@code resource:permission}.
     *
     * @param value e.g. "user:read"
     * @return the resource permission
     * @throws IllegalArgumentException if the format, resource or permission is invalid
     */
    public static ResourcePermission parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Invalid permission format: null");
        }
        final var separator = value.indexOf(':');
        if (separator <= 0 || separator == value.length() - 1) {
            throw new IllegalArgumentException("Invalid permission format: " + value);
        }
        return new ResourcePermission(
                Resource.fromValue(value.substring(0, separator)),
                Permission.fromValue(value.substring(separator + 1)));
    }

    @Override
    public String toString() {
        return resource.value() + ":" + permission.value();
    }
}
