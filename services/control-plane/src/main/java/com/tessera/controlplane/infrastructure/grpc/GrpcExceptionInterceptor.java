package com.tessera.controlplane.infrastructure.grpc;

import com.tessera.security.error.ControlPlaneException;
import com.tessera.security.error.ErrorCode;
import com.tessera.security.error.ErrorEnvelopes;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps exceptions escaping a gRPC handler to a status the client can act on.
 *
 * <p>Exceptions thrown from {@code onMessage} or {@code onHalfClose} are mapped here, as are calls
 * closed with {@code UNKNOWN} and a cause. A {@link ControlPlaneException} becomes the status of its
 * error code, with the code in the {@code x-error-code} trailer. A {@link StatusRuntimeException}
 * keeps its status. Anything else becomes {@code INTERNAL}, with a generic description outside
 * development.
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    private final ErrorEnvelopes envelopes;

    public GrpcExceptionInterceptor(ErrorEnvelopes envelopes) {
        this.envelopes = envelopes;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        ServerCall<ReqT, RespT> wrappedCall =
                new ForwardingServerCall.SimpleForwardingServerCall<ReqT, RespT>(call) {
                    @Override
                    public void close(Status status, Metadata trailers) {
                        if (status.getCode() == Status.Code.UNKNOWN && status.getCause() != null) {
                            Throwable cause = status.getCause();
                            status = mapException(cause);
                            if (!(cause instanceof StatusRuntimeException)) {
                                trailers.merge(GrpcErrors.trailersOf(ErrorEnvelopes.codeOf(cause)));
                            }
                        }
                        super.close(status, trailers);
                    }
                };

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT>(
                next.startCall(wrappedCall, headers)) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (RuntimeException e) {
                    closeWith(call, e);
                }
            }

            @Override
            public void onHalfClose() {
                try {
                    super.onHalfClose();
                } catch (RuntimeException e) {
                    closeWith(call, e);
                }
            }
        };
    }

    private void closeWith(ServerCall<?, ?> call, RuntimeException failure) {
        Metadata trailers = failure instanceof StatusRuntimeException sre && sre.getTrailers() != null
                ? sre.getTrailers()
                : GrpcErrors.trailersOf(ErrorEnvelopes.codeOf(failure));
        call.close(mapException(failure), trailers);
    }

    /** Package-private for testing. */
    Status mapException(Throwable throwable) {
        if (throwable instanceof ControlPlaneException e) {
            ErrorCode code = e.errorCode();
            log.info("gRPC call rejected: {} ({})", code.code(), e.getMessage());
            return GrpcErrors.statusOf(code).withDescription(e.getMessage()).withCause(e);
        }
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        log.error("gRPC internal error", throwable);
        String description = envelopes.from(throwable, null).message();
        if (envelopes.detailed()) {
            description = description + ": " + throwable;
        }
        return Status.INTERNAL.withDescription(description).withCause(throwable);
    }
}
