package com.tessera.security.permission;

import com.tessera.security.error.ValidationException;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * A {@code resource:action} pair, e.g. {@code sessions:terminate}.
 * Both parts are lowercase identifiers made of letters, digits and underscores.
 */
public record Permission(String resource, String action) implements Comparable<Permission> {

    /** Resource of the platform administration permissions, which tenant overrides cannot change. */
    public static final String PLATFORM_RESOURCE = "admin";

    private static final Pattern PART = Pattern.compile("[a-z][a-z0-9_]*");

    public Permission {
        if (resource == null || !PART.matcher(resource).matches()) {
            throw new ValidationException("invalid permission resource: " + resource,
                    Map.of("resource", String.valueOf(resource)));
        }
        if (action == null || !PART.matcher(action).matches()) {
            throw new ValidationException("invalid permission action: " + action,
                    Map.of("action", String.valueOf(action)));
        }
    }

    public static Permission of(String resource, String action) {
        return new Permission(resource, action);
    }

    /**
     * @throws ValidationException if {@code value} is not of the form {@code resource:action}
     */
    public static Permission parse(String value) {
        if (value == null) {
            throw new ValidationException("permission must not be null");
        }
        int colon = value.indexOf(':');
        if (colon <= 0 || colon != value.lastIndexOf(':')) {
            throw new ValidationException("permission must have the form resource:action",
                    Map.of("permission", value));
        }
        return new Permission(value.substring(0, colon).trim(), value.substring(colon + 1).trim());
    }

    public boolean isPlatformScoped() {
        return PLATFORM_RESOURCE.equals(resource);
    }

    @Override
    public int compareTo(Permission other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public String toString() {
        return resource + ":" + action;
    }
}
