package com.tessera.security.error;

import java.util.Map;

/**
 * The caller is authenticated but not allowed to perform {@code resource:action}.
 * The failing permission is always named, both in the message and in the details.
 */
public class PermissionDeniedException extends ControlPlaneException {

    private final String permission;

    public PermissionDeniedException(String permission) {
        this(ErrorCode.PERMISSION_DENIED, permission, "Permission denied: " + permission);
    }

    private PermissionDeniedException(ErrorCode code, String permission, String message) {
        super(code, message, Map.of("permission", permission));
        this.permission = permission;
    }

    /**
     * An API key lacks the scope an operation requires.
     */
    public static PermissionDeniedException insufficientScope(String scope) {
        return new PermissionDeniedException(ErrorCode.INSUFFICIENT_SCOPE, "scope:" + scope,
                "API key lacks required scope: " + scope);
    }

    /** The denied permission as {@code resource:action}. */
    public String permission() {
        return permission;
    }
}
