package com.tessera.security.error;

import java.util.Map;

/**
 * Malformed input.
 */
public class ValidationException extends ControlPlaneException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, ?> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
