package com.tessera.security.error;

/**
 * The presented credential could not be turned into a principal.
 * <p>
 * Every failure mode has its own {@link ErrorCode}. An unknown API key and an API key whose secret
 * does not match share {@link ErrorCode#INVALID_API_KEY} so that callers cannot probe for valid
 * key prefixes.
 */
public class AuthenticationException extends ControlPlaneException {

    private AuthenticationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, null, cause);
        if (errorCode.httpStatus() != 401) {
            throw new IllegalArgumentException("not an authentication error code: " + errorCode);
        }
    }

    public static AuthenticationException credentialRequired() {
        return new AuthenticationException(ErrorCode.INVALID_TOKEN, "Authentication required", null);
    }

    public static AuthenticationException tokenExpired(Throwable cause) {
        return new AuthenticationException(ErrorCode.TOKEN_EXPIRED, "Token has expired", cause);
    }

    public static AuthenticationException invalidToken(String reason, Throwable cause) {
        return new AuthenticationException(ErrorCode.INVALID_TOKEN, "Invalid token: " + reason, cause);
    }

    public static AuthenticationException invalidApiKey() {
        return new AuthenticationException(ErrorCode.INVALID_API_KEY, "Invalid API key", null);
    }

    public static AuthenticationException apiKeyExpired() {
        return new AuthenticationException(ErrorCode.API_KEY_EXPIRED, "API key has expired", null);
    }

    public static AuthenticationException apiKeyRevoked() {
        return new AuthenticationException(ErrorCode.API_KEY_REVOKED, "API key has been revoked", null);
    }
}
