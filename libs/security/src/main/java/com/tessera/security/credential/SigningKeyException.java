package com.tessera.security.credential;

/**
 * A signing key could not be obtained, either because the identity provider is unreachable or
 * because it does not know the requested key id.
 */
public class SigningKeyException extends RuntimeException {

    public SigningKeyException(String message) {
        super(message);
    }

    public SigningKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
