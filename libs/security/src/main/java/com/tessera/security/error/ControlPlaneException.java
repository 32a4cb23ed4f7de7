package com.tessera.security.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for every expected, typed failure of the control plane.
 * <p>
 * These are outcomes rather than bugs: they are recovered at the boundary nearest the transport
 * and rendered as an {@link ErrorEnvelope}. Anything that is not a {@code ControlPlaneException}
 * reaching that boundary is treated as an internal error.
 */
public class ControlPlaneException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    public ControlPlaneException(ErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    public ControlPlaneException(ErrorCode errorCode, String message, Map<String, ?> details) {
        this(errorCode, message, details, null);
    }

    public ControlPlaneException(ErrorCode errorCode, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode must not be null");
        }
        this.errorCode = errorCode;
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Map.copyOf(new LinkedHashMap<>(details));
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /** Structured, client-safe details rendered in the envelope's {@code details} field. */
    public Map<String, Object> details() {
        return details;
    }
}
