package com.tessera.security.guard;

import com.tessera.observability.SpanHelper;
import com.tessera.security.credential.CredentialValidator;
import com.tessera.security.credential.Principal;
import com.tessera.security.error.PermissionDeniedException;
import com.tessera.security.ratelimit.RateLimitDecision;
import com.tessera.security.ratelimit.RateLimiter;
import com.tessera.security.tenant.Tenant;
import com.tessera.security.tenant.TenantResolver;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;

import java.util.Map;
import java.util.function.Supplier;

/**
 * The admission pipeline every tenant-scoped request passes through, independent of transport.
 * <p>
 * Steps, in order, each of which may end the request with a typed exception:
 * <ol>
 *   <li>credential validation;</li>
 *   <li>tenant resolution, with the credential's tenant as the first hint so that a header or
 *       subdomain naming another tenant is a mismatch;</li>
 *   <li>rate-limit admission;</li>
 *   <li>the required API key scope and permission, when the endpoint declares them.</li>
 * </ol>
 * The returned {@link AccessGrant} is not bound; transports bind its scope with
 * {@link TenantScopes#bind(TenantScope)} around the handler, or use {@link #run}.
 */
public final class AccessGuard {

    private final CredentialValidator credentials;
    private final TenantResolver tenants;
    private final RateLimiter rateLimiter;
    private final PermissionGuard permissions;
    private final SpanHelper spans;

    public AccessGuard(CredentialValidator credentials, TenantResolver tenants, RateLimiter rateLimiter,
                       PermissionGuard permissions, SpanHelper spans) {
        if (credentials == null || tenants == null || rateLimiter == null || permissions == null || spans == null) {
            throw new IllegalArgumentException("all collaborators are required");
        }
        this.credentials = credentials;
        this.tenants = tenants;
        this.rateLimiter = rateLimiter;
        this.permissions = permissions;
        this.spans = spans;
    }

    public AccessGrant enter(AccessRequest request) {
        return spans.inSpan("tessera.access", Map.of("transport", request.transport()), () -> {
            Principal principal = credentials.validate(request.credential(), request.clientIp());
            Tenant tenant = tenants.resolve(request.hints().withClaim(principal.tenantId()));
            TenantScope scope = new TenantScope(tenant, principal, request.requestId());
            RateLimitDecision decision = rateLimiter.admit(principal, request.clientIp());
            if (request.requiredScope() != null && !principal.hasScope(request.requiredScope())) {
                throw PermissionDeniedException.insufficientScope(request.requiredScope());
            }
            if (request.permission() != null) {
                permissions.require(scope, request.permission(), request.targetResourceId());
            }
            return new AccessGrant(scope, decision);
        });
    }

    /**
     * Admits the request and runs {@code handler} with the scope bound.
     */
    public <T> T run(AccessRequest request, Supplier<T> handler) {
        AccessGrant grant = enter(request);
        try (TenantScopes.Binding ignored = TenantScopes.bind(grant.scope())) {
            return handler.get();
        }
    }

    public PermissionGuard permissions() {
        return permissions;
    }
}
