package com.tessera.security.permission;

/**
 * @param grantingRole the role that allowed the request, or null
 */
public record PermissionDecision(boolean allowed, Permission permission, DecisionSource source, String grantingRole) {

    static PermissionDecision allow(Permission permission, DecisionSource source, String role) {
        return new PermissionDecision(true, permission, source, role);
    }

    static PermissionDecision deny(Permission permission) {
        return new PermissionDecision(false, permission, DecisionSource.NONE, null);
    }
}
