package com.tessera.security.error;

import java.util.Optional;

/**
 * Stable, transport-independent error codes surfaced to callers.
 * <p>
 * Each code carries the HTTP-equivalent status and the close code used when the same failure
 * happens while opening a streaming connection. The string value is part of the public contract:
 * clients branch on it, so existing values must never change.
 */
public enum ErrorCode {

    VALIDATION_ERROR("validation_error", 400, StreamCloseCode.INVALID_REQUEST),
    TENANT_REQUIRED("tenant_required", 400, StreamCloseCode.TENANT_REQUIRED),

    TOKEN_EXPIRED("token_expired", 401, StreamCloseCode.AUTH_FAILED),
    INVALID_TOKEN("invalid_token", 401, StreamCloseCode.AUTH_FAILED),
    INVALID_API_KEY("invalid_api_key", 401, StreamCloseCode.AUTH_FAILED),
    API_KEY_EXPIRED("api_key_expired", 401, StreamCloseCode.AUTH_FAILED),
    API_KEY_REVOKED("api_key_revoked", 401, StreamCloseCode.AUTH_FAILED),

    PERMISSION_DENIED("permission_denied", 403, StreamCloseCode.FORBIDDEN),
    INSUFFICIENT_SCOPE("insufficient_scope", 403, StreamCloseCode.FORBIDDEN),
    TENANT_SUSPENDED("tenant_suspended", 403, StreamCloseCode.FORBIDDEN),
    TENANT_MISMATCH("tenant_mismatch", 403, StreamCloseCode.TENANT_REQUIRED),
    TENANT_LIMIT_EXCEEDED("tenant_limit_exceeded", 403, StreamCloseCode.FORBIDDEN),

    NOT_FOUND("not_found", 404, StreamCloseCode.NOT_FOUND),
    TENANT_NOT_FOUND("tenant_not_found", 404, StreamCloseCode.NOT_FOUND),

    CONFLICT("conflict", 409, StreamCloseCode.CONFLICT),
    AUDIT_IMMUTABLE("audit_immutable", 409, StreamCloseCode.CONFLICT),

    RATE_LIMIT_EXCEEDED("rate_limit_exceeded", 429, StreamCloseCode.RATE_LIMITED),

    INTERNAL_ERROR("internal_error", 500, StreamCloseCode.INTERNAL);

    private final String code;
    private final int httpStatus;
    private final StreamCloseCode closeCode;

    ErrorCode(String code, int httpStatus, StreamCloseCode closeCode) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.closeCode = closeCode;
    }

    /** The wire value, e.g. {@code "permission_denied"}. */
    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public StreamCloseCode closeCode() {
        return closeCode;
    }

    /**
     * Looks up a code by its wire value.
     */
    public static Optional<ErrorCode> fromCode(String value) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(value)) {
                return Optional.of(errorCode);
            }
        }
        return Optional.empty();
    }
}
