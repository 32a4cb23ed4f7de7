package com.tessera.security.tenant;

import com.tessera.security.error.TenantException;
import com.tessera.security.error.TenantMismatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Establishes the tenant of a request from its {@link TenantHints} and checks that the tenant may
 * be used.
 * <p>
 * Hints are read in precedence order: credential claim, tenant header, subdomain. Every present
 * hint must name the same tenant; if two disagree the request is rejected with
 * {@code tenant_mismatch} and neither tenant is used. A subdomain counts as a hint only when it is
 * the slug of a known tenant, since hosts like {@code api.example.com} carry no tenant.
 * <p>
 * The tenant status is checked on every call: suspended tenants yield {@code tenant_suspended},
 * deleted and unknown tenants yield {@code tenant_not_found}.
 */
public final class TenantResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    private record Hint(String source, String tenantId) {
    }

    private final TenantDirectory directory;

    public TenantResolver(TenantDirectory directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        this.directory = directory;
    }

    /**
     * @throws TenantException         when no tenant can be established, or it is unusable
     * @throws TenantMismatchException when present hints disagree
     */
    public Tenant resolve(TenantHints hints) {
        List<Hint> present = new ArrayList<>(3);
        if (hints.claimTenantId() != null) {
            present.add(new Hint("credential", hints.claimTenantId()));
        }
        if (hints.headerTenantId() != null) {
            present.add(new Hint(TenantHints.TENANT_HEADER + " header", hints.headerTenantId()));
        }
        if (hints.subdomain() != null) {
            Optional<Tenant> bySlug = directory.findBySlug(hints.subdomain());
            if (bySlug.isPresent()) {
                present.add(new Hint("subdomain", bySlug.get().id()));
            } else {
                log.debug("Subdomain '{}' is not a tenant slug, ignoring", hints.subdomain());
            }
        }

        if (present.isEmpty()) {
            throw TenantException.required();
        }

        Hint first = present.get(0);
        for (Hint other : present.subList(1, present.size())) {
            if (!first.tenantId().equals(other.tenantId())) {
                log.warn("Rejecting request with conflicting tenant hints: {} vs {}", first.source(), other.source());
                throw TenantMismatchException.conflictingHints(
                        first.source(), first.tenantId(), other.source(), other.tenantId());
            }
        }
        return requireUsable(first.tenantId());
    }

    /**
     * Loads a tenant by id and checks its status.
     */
    public Tenant requireUsable(String tenantId) {
        Tenant tenant = directory.findById(tenantId)
                .orElseThrow(() -> TenantException.notFound(tenantId));
        return switch (tenant.status()) {
            case ACTIVE, PENDING -> tenant;
            case SUSPENDED -> {
                log.info("Rejecting request for suspended tenant {}", tenantId);
                throw TenantException.suspended(tenantId);
            }
            case DELETED -> throw TenantException.notFound(tenantId);
        };
    }
}
