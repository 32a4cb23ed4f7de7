package com.tessera.controlplane.api;

import com.tessera.controlplane.infrastructure.web.ClientAddress;
import com.tessera.security.audit.Actor;
import com.tessera.security.credential.Principal;
import com.tessera.security.error.PermissionDeniedException;
import com.tessera.security.guard.PermissionGuard;
import com.tessera.security.permission.Permission;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Per-endpoint checks on top of the admission done by the access guard filter.
 *
 * <p>Controllers call one of these first; each returns the scope bound for the request. Management
 * endpoints also require API key callers to hold the {@code admin} scope.
 */
@Component
public class EndpointAccess {

    private final PermissionGuard permissions;

    public EndpointAccess(PermissionGuard permissions) {
        this.permissions = permissions;
    }

    public TenantScope require(Permission permission) {
        return require(permission, null);
    }

    public TenantScope require(Permission permission, String targetResourceId) {
        TenantScope scope = TenantScopes.require();
        permissions.require(scope, permission, targetResourceId);
        return scope;
    }

    public TenantScope requireManagement(Permission permission, String targetResourceId) {
        TenantScope scope = TenantScopes.require();
        if (!scope.principal().hasScope(Principal.ADMIN_SCOPE)) {
            throw PermissionDeniedException.insufficientScope(Principal.ADMIN_SCOPE);
        }
        permissions.require(scope, permission, targetResourceId);
        return scope;
    }

    /** The caller of the current request, as recorded in audit entries. */
    public static Actor actor(TenantScope scope, HttpServletRequest request) {
        return Actor.of(scope.principal(), ClientAddress.of(request));
    }
}
