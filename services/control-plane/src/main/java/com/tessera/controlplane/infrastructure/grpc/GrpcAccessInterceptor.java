package com.tessera.controlplane.infrastructure.grpc;

import com.tessera.security.audit.Actor;
import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditEvent;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.credential.CredentialExtractor;
import com.tessera.security.error.ControlPlaneException;
import com.tessera.security.error.ErrorCode;
import com.tessera.security.error.ErrorEnvelopes;
import com.tessera.security.guard.AccessGrant;
import com.tessera.security.guard.AccessGuard;
import com.tessera.security.guard.AccessRequest;
import com.tessera.security.permission.Permission;
import com.tessera.security.tenant.TenantHints;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Grpc;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admits gRPC calls through the {@link AccessGuard}.
 *
 * <p>Credentials are read from the {@code authorization} or {@code x-api-key} metadata, the tenant
 * hint from {@code x-tenant-id} and the authority. Methods listed in the permission map require
 * that permission. A rejected call is closed immediately with the mapped status and the
 * {@code x-error-code} and {@code x-close-code} trailers; the handler never starts.
 *
 * <p>gRPC may deliver the callbacks of one call on different threads, so the tenant scope is bound
 * around each callback rather than once. A call the client cancels before it completes is audited
 * as {@code request_abandoned}.
 */
public class GrpcAccessInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcAccessInterceptor.class);

    public static final Metadata.Key<String> AUTHORIZATION_KEY =
            Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);
    public static final Metadata.Key<String> API_KEY_KEY =
            Metadata.Key.of("x-api-key", Metadata.ASCII_STRING_MARSHALLER);
    public static final Metadata.Key<String> TENANT_KEY =
            Metadata.Key.of("x-tenant-id", Metadata.ASCII_STRING_MARSHALLER);
    public static final Metadata.Key<String> REQUEST_ID_KEY =
            Metadata.Key.of("x-request-id", Metadata.ASCII_STRING_MARSHALLER);

    private final AccessGuard guard;
    private final AuditLedger audit;
    private final ErrorEnvelopes envelopes;
    private final Map<String, Permission> methodPermissions;

    /**
     * @param methodPermissions permission required per full method name, e.g.
     *                          {@code tessera.v1.ApiKeys/Revoke}; unlisted methods only need a
     *                          valid credential
     */
    public GrpcAccessInterceptor(
            AccessGuard guard,
            AuditLedger audit,
            ErrorEnvelopes envelopes,
            Map<String, Permission> methodPermissions) {
        if (guard == null || audit == null || envelopes == null) {
            throw new IllegalArgumentException("guard, audit and envelopes are required");
        }
        this.guard = guard;
        this.audit = audit;
        this.envelopes = envelopes;
        this.methodPermissions = methodPermissions == null ? Map.of() : Map.copyOf(methodPermissions);
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String method = call.getMethodDescriptor().getFullMethodName();
        String requestId = headers.get(REQUEST_ID_KEY);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        String credential = CredentialExtractor.extract(headers.get(AUTHORIZATION_KEY), headers.get(API_KEY_KEY))
                .orElse(null);
        AccessRequest request = AccessRequest.of(
                credential,
                TenantHints.fromRequest(headers.get(TENANT_KEY), call.getAuthority()),
                clientIp(call),
                requestId,
                "grpc");
        Permission permission = methodPermissions.get(method);
        if (permission != null) {
            request = request.requiring(permission, null);
        }

        AccessGrant grant;
        try {
            grant = guard.enter(request);
        } catch (RuntimeException e) {
            reject(call, method, e);
            return new ServerCall.Listener<>() {};
        }

        TenantScope scope = grant.scope();
        ServerCall.Listener<ReqT> delegate;
        try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
            delegate = next.startCall(call, headers);
        }
        return new ScopedListener<>(delegate, scope, method);
    }

    private void reject(ServerCall<?, ?> call, String method, RuntimeException failure) {
        ErrorCode code = ErrorEnvelopes.codeOf(failure);
        if (failure instanceof ControlPlaneException) {
            log.info("Rejected gRPC call {}: {}", method, code.code());
        } else {
            log.error("Access check failed for gRPC call {}", method, failure);
        }
        String description = envelopes.from(failure, null).message();
        call.close(GrpcErrors.statusOf(code).withDescription(description), GrpcErrors.trailersOf(code));
    }

    private static String clientIp(ServerCall<?, ?> call) {
        SocketAddress remote = call.getAttributes().get(Grpc.TRANSPORT_ATTR_REMOTE_ADDR);
        if (remote instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return null;
    }

    private final class ScopedListener<ReqT>
            extends ForwardingServerCallListener.SimpleForwardingServerCallListener<ReqT> {

        private final TenantScope scope;
        private final String method;
        private final AtomicBoolean completed = new AtomicBoolean();

        ScopedListener(ServerCall.Listener<ReqT> delegate, TenantScope scope, String method) {
            super(delegate);
            this.scope = scope;
            this.method = method;
        }

        @Override
        public void onMessage(ReqT message) {
            try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
                super.onMessage(message);
            }
        }

        @Override
        public void onHalfClose() {
            try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
                super.onHalfClose();
            }
        }

        @Override
        public void onReady() {
            try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
                super.onReady();
            }
        }

        @Override
        public void onComplete() {
            completed.set(true);
            try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
                super.onComplete();
            }
        }

        @Override
        public void onCancel() {
            try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
                super.onCancel();
            } finally {
                if (!completed.get()) {
                    recordAbandoned();
                }
            }
        }

        private void recordAbandoned() {
            log.info("gRPC call {} cancelled by the client before completion", method);
            audit.record(AuditEvent.builder(AuditAction.REQUEST_ABANDONED, "grpc_call")
                    .tenant(scope.tenantId())
                    .actor(Actor.of(scope.principal()))
                    .resource(method)
                    .description("Client cancelled " + method)
                    .requestId(scope.requestId())
                    .build());
        }
    }
}
