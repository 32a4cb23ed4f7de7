package com.tessera.security.error;

import java.util.Map;

/**
 * Two tenant identities that must agree do not.
 * <p>
 * Raised when request hints (token claim, header, subdomain) name different tenants, and when
 * a loaded resource belongs to a tenant other than the one the request is bound to. The request
 * is rejected; neither tenant is chosen.
 */
public class TenantMismatchException extends ControlPlaneException {

    private final String expectedTenantId;
    private final String actualTenantId;

    public TenantMismatchException(String expectedTenantId, String actualTenantId) {
        this(expectedTenantId, actualTenantId,
                "Tenant mismatch: context tenant '%s' cannot access resource of tenant '%s'"
                        .formatted(expectedTenantId, actualTenantId));
    }

    public TenantMismatchException(String expectedTenantId, String actualTenantId, String message) {
        super(ErrorCode.TENANT_MISMATCH, message);
        this.expectedTenantId = expectedTenantId;
        this.actualTenantId = actualTenantId;
    }

    /**
     * Two request hints named different tenants.
     */
    public static TenantMismatchException conflictingHints(String firstSource, String firstTenant,
                                                           String secondSource, String secondTenant) {
        return new TenantMismatchException(firstTenant, secondTenant,
                "Tenant mismatch: %s names '%s' but %s names '%s'"
                        .formatted(firstSource, firstTenant, secondSource, secondTenant));
    }

    public String expectedTenantId() {
        return expectedTenantId;
    }

    public String actualTenantId() {
        return actualTenantId;
    }

    /** Tenant identifiers are deliberately kept out of the client-facing details. */
    @Override
    public Map<String, Object> details() {
        return Map.of();
    }
}
