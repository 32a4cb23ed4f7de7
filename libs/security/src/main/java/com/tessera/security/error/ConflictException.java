package com.tessera.security.error;

public class ConflictException extends ControlPlaneException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
