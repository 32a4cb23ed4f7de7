package com.tessera.security.guard;

import com.tessera.security.permission.Permission;
import com.tessera.security.tenant.TenantHints;

/**
 * Everything the guard needs from the transport to admit one request.
 *
 * @param credential       raw credential, or null if none was presented
 * @param hints            tenant hints from the header and the host; the credential's own tenant
 *                         is added by the guard
 * @param permission       permission the endpoint requires, or null for none
 * @param targetResourceId id of the resource acted on, for conditions and relationship checks
 * @param requiredScope    API key scope the endpoint requires, or null
 * @param transport        {@code http} or {@code grpc}, for tracing
 */
public record AccessRequest(
        String credential,
        TenantHints hints,
        String clientIp,
        String requestId,
        Permission permission,
        String targetResourceId,
        String requiredScope,
        String transport
) {

    public AccessRequest {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        hints = hints == null ? TenantHints.none() : hints;
        transport = transport == null ? "unknown" : transport;
    }

    public static AccessRequest of(String credential, TenantHints hints, String clientIp, String requestId,
                                   String transport) {
        return new AccessRequest(credential, hints, clientIp, requestId, null, null, null, transport);
    }

    public AccessRequest requiring(Permission requiredPermission, String target) {
        return new AccessRequest(credential, hints, clientIp, requestId, requiredPermission, target,
                requiredScope, transport);
    }

    public AccessRequest requiringScope(String scope) {
        return new AccessRequest(credential, hints, clientIp, requestId, permission, targetResourceId,
                scope, transport);
    }
}
