package com.tessera.security.error;

/**
 * Close codes for streaming transports (WebSocket-style connections).
 * <p>
 * A connection rejected during setup is closed with one of these codes so that clients can tell
 * an authentication failure from a missing tenant or a rate limit without parsing the reason text.
 * Application codes live in the 4000-4999 range; {@link #INTERNAL} uses the standard 1011.
 */
public enum StreamCloseCode {

    AUTH_FAILED(4001, "authentication failed"),
    TENANT_REQUIRED(4003, "tenant required"),
    RATE_LIMITED(4029, "rate limited"),
    INVALID_REQUEST(4400, "invalid request"),
    FORBIDDEN(4403, "forbidden"),
    NOT_FOUND(4404, "not found"),
    CONFLICT(4409, "conflict"),
    INTERNAL(1011, "internal error");

    private final int code;
    private final String reason;

    StreamCloseCode(int code, String reason) {
        this.code = code;
        this.reason = reason;
    }

    public int code() {
        return code;
    }

    public String reason() {
        return reason;
    }
}
