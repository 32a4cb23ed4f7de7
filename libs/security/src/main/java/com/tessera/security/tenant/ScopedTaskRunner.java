package com.tessera.security.tenant;

import com.tessera.security.credential.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Runs background work under a scope that was encoded with {@link TenantScopeCodec} when the work
 * was enqueued. The tenant status is checked again before the task runs.
 */
public final class ScopedTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(ScopedTaskRunner.class);

    private final TenantResolver resolver;

    public ScopedTaskRunner(TenantResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        this.resolver = resolver;
    }

    /**
     * @throws com.tessera.security.error.TenantException if the tenant is no longer usable
     */
    public void run(String encodedScope, Runnable task) {
        call(encodedScope, () -> {
            task.run();
            return null;
        });
    }

    public <T> T call(String encodedScope, Supplier<T> task) {
        TenantScopeCodec.ScopeTicket ticket = TenantScopeCodec.decode(encodedScope);
        Tenant tenant = resolver.requireUsable(ticket.tenantId());
        Principal principal = ticket.principal();
        TenantScope scope = new TenantScope(tenant, principal, ticket.requestId());
        try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
            log.debug("Running background task for tenant {}", tenant.id());
            return task.get();
        }
    }
}
