package com.tessera.security.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tenant could not be established for the request, or the tenant may not be used.
 */
public class TenantException extends ControlPlaneException {

    private final String tenantId;

    private TenantException(ErrorCode code, String tenantId, String message, Map<String, ?> details) {
        super(code, message, details);
        this.tenantId = tenantId;
    }

    public static TenantException required() {
        return new TenantException(ErrorCode.TENANT_REQUIRED, null, "Tenant context is required", Map.of());
    }

    public static TenantException notFound(String tenantId) {
        return new TenantException(ErrorCode.TENANT_NOT_FOUND, tenantId,
                "Tenant not found: " + tenantId, Map.of("tenant_id", tenantId));
    }

    public static TenantException suspended(String tenantId) {
        return new TenantException(ErrorCode.TENANT_SUSPENDED, tenantId,
                "Tenant is suspended: " + tenantId, Map.of("tenant_id", tenantId));
    }

    public static TenantException limitExceeded(String tenantId, String limit, long maximum) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tenant_id", tenantId);
        details.put("limit", limit);
        details.put("maximum", maximum);
        return new TenantException(ErrorCode.TENANT_LIMIT_EXCEEDED, tenantId,
                "Tenant limit exceeded for %s (maximum %d)".formatted(limit, maximum), details);
    }

    /** The tenant concerned, or null when no tenant could be established. */
    public String tenantId() {
        return tenantId;
    }
}
