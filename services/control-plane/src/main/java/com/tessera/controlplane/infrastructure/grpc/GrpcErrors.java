package com.tessera.controlplane.infrastructure.grpc;

import com.tessera.security.error.ErrorCode;
import io.grpc.Metadata;
import io.grpc.Status;

/** Translation of control-plane error codes to gRPC statuses and trailers. */
final class GrpcErrors {

    static final Metadata.Key<String> ERROR_CODE_KEY =
            Metadata.Key.of("x-error-code", Metadata.ASCII_STRING_MARSHALLER);
    static final Metadata.Key<String> CLOSE_CODE_KEY =
            Metadata.Key.of("x-close-code", Metadata.ASCII_STRING_MARSHALLER);

    private GrpcErrors() {}

    static Status statusOf(ErrorCode code) {
        if (code == ErrorCode.TENANT_REQUIRED) {
            return Status.FAILED_PRECONDITION;
        }
        return switch (code.httpStatus()) {
            case 400 -> Status.INVALID_ARGUMENT;
            case 401 -> Status.UNAUTHENTICATED;
            case 403 -> Status.PERMISSION_DENIED;
            case 404 -> Status.NOT_FOUND;
            case 409 -> code == ErrorCode.CONFLICT ? Status.ALREADY_EXISTS : Status.ABORTED;
            case 429 -> Status.RESOURCE_EXHAUSTED;
            default -> Status.INTERNAL;
        };
    }

    /** Trailers carrying the stable error code and the matching stream close code. */
    static Metadata trailersOf(ErrorCode code) {
        Metadata trailers = new Metadata();
        trailers.put(ERROR_CODE_KEY, code.code());
        trailers.put(CLOSE_CODE_KEY, Integer.toString(code.closeCode().code()));
        return trailers;
    }
}
