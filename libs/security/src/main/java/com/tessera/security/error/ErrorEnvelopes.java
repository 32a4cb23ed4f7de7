package com.tessera.security.error;

import java.util.Map;

/**
 * Builds {@link ErrorEnvelope}s from exceptions.
 * <p>
 * {@link ControlPlaneException}s are rendered with their own code, message and details.
 * Anything else becomes {@code internal_error}: in production the message is generic and no
 * exception text leaks; in development the exception class and message are included.
 */
public final class ErrorEnvelopes {

    static final String GENERIC_MESSAGE = "An unexpected error occurred";

    private final boolean detailed;

    /**
     * @param detailed whether unexpected exceptions may be described to the caller
     */
    public ErrorEnvelopes(boolean detailed) {
        this.detailed = detailed;
    }

    /**
     * Production unless {@code environment} is {@code development}, {@code dev}, {@code local}
     * or {@code test}.
     */
    public static ErrorEnvelopes forEnvironment(String environment) {
        String env = environment == null ? "" : environment.trim().toLowerCase();
        return new ErrorEnvelopes(env.equals("development") || env.equals("dev")
                || env.equals("local") || env.equals("test"));
    }

    public ErrorEnvelope from(Throwable failure, String requestId) {
        if (failure instanceof ControlPlaneException e) {
            return new ErrorEnvelope(e.errorCode().code(), e.getMessage(), e.details(), requestId);
        }
        if (detailed && failure != null) {
            return new ErrorEnvelope(ErrorCode.INTERNAL_ERROR.code(), GENERIC_MESSAGE,
                    Map.of("exception", failure.getClass().getName(),
                            "cause", String.valueOf(failure.getMessage())),
                    requestId);
        }
        return new ErrorEnvelope(ErrorCode.INTERNAL_ERROR.code(), GENERIC_MESSAGE, Map.of(), requestId);
    }

    /**
     * Error code for any throwable; unexpected exceptions map to {@link ErrorCode#INTERNAL_ERROR}.
     */
    public static ErrorCode codeOf(Throwable failure) {
        return failure instanceof ControlPlaneException e ? e.errorCode() : ErrorCode.INTERNAL_ERROR;
    }

    public boolean detailed() {
        return detailed;
    }
}
