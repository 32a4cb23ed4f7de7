package com.tessera.observability;

/**
 * Immutable set of identifiers attached to every log line emitted while a request is in flight.
 * <p>
 * Values are mirrored into the SLF4J MDC by {@link LogContextHolder} so that log output can be
 * correlated by request and segmented by tenant without passing identifiers through every call.
 *
 * @param requestId     unique ID for this request; never blank
 * @param tenantId      tenant the request is bound to (nullable before tenant resolution)
 * @param principalId   authenticated caller (nullable before authentication)
 * @param principalType kind of caller, e.g. {@code user} or {@code api_key} (nullable)
 */
public record LogContext(
        String requestId,
        String tenantId,
        String principalId,
        String principalType
) {

    /** MDC key for the request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for the principal ID. */
    public static final String MDC_PRINCIPAL_ID = "principalId";

    /** MDC key for the principal type. */
    public static final String MDC_PRINCIPAL_TYPE = "principalType";

    public LogContext {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
    }

    /**
     * Creates a context that carries only a request ID.
     */
    public static LogContext forRequest(String requestId) {
        return new LogContext(requestId, null, null, null);
    }
}
