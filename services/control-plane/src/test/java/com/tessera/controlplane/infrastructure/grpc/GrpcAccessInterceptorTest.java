package com.tessera.controlplane.infrastructure.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditEvent;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.error.AuthenticationException;
import com.tessera.security.error.ErrorEnvelopes;
import com.tessera.security.guard.AccessGrant;
import com.tessera.security.guard.AccessGuard;
import com.tessera.security.guard.AccessRequest;
import com.tessera.security.permission.Permission;
import com.tessera.security.ratelimit.RateLimitDecision;
import com.tessera.security.ratelimit.RateLimitTier;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import com.tessera.security.testing.TestPrincipals;
import io.grpc.Attributes;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.Status;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("GrpcAccessInterceptor")
class GrpcAccessInterceptorTest {

    private static final String METHOD = "tessera.audit.v1.AuditService/Search";
    private static final Permission AUDIT_READ = Permission.of("audit", "read");

    private AccessGuard guard;
    private AuditLedger audit;
    private GrpcAccessInterceptor interceptor;
    private ServerCall<String, String> call;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        guard = mock(AccessGuard.class);
        audit = mock(AuditLedger.class);
        interceptor = new GrpcAccessInterceptor(guard, audit, new ErrorEnvelopes(false), Map.of(METHOD, AUDIT_READ));

        MethodDescriptor.Marshaller<String> marshaller = mock(MethodDescriptor.Marshaller.class);
        MethodDescriptor<String, String> descriptor = MethodDescriptor.<String, String>newBuilder()
                .setType(MethodDescriptor.MethodType.UNARY)
                .setFullMethodName(METHOD)
                .setRequestMarshaller(marshaller)
                .setResponseMarshaller(marshaller)
                .build();
        call = mock(ServerCall.class);
        when(call.getMethodDescriptor()).thenReturn(descriptor);
        when(call.getAttributes()).thenReturn(Attributes.EMPTY);
    }

    private static Metadata headers(String apiKey) {
        Metadata headers = new Metadata();
        headers.put(GrpcAccessInterceptor.API_KEY_KEY, apiKey);
        headers.put(GrpcAccessInterceptor.REQUEST_ID_KEY, "grpc-req-1");
        return headers;
    }

    private static AccessGrant grant(TenantScope scope) {
        return new AccessGrant(scope, RateLimitDecision.unlimited(RateLimitTier.UNLIMITED, Instant.EPOCH));
    }

    @Test
    @DisplayName("closes a rejected call with the mapped status and never starts the handler")
    @SuppressWarnings("unchecked")
    void rejectsCall() {
        when(guard.enter(any())).thenThrow(AuthenticationException.credentialRequired());
        ServerCallHandler<String, String> next = mock(ServerCallHandler.class);

        interceptor.interceptCall(call, new Metadata(), next);

        var status = ArgumentCaptor.forClass(Status.class);
        var trailers = ArgumentCaptor.forClass(Metadata.class);
        verify(call).close(status.capture(), trailers.capture());
        assertThat(status.getValue().getCode()).isEqualTo(Status.Code.UNAUTHENTICATED);
        assertThat(trailers.getValue().get(GrpcErrors.ERROR_CODE_KEY)).isEqualTo("invalid_token");
        verify(next, never()).startCall(any(), any());
    }

    @Test
    @DisplayName("requires the permission configured for the method")
    void appliesMethodPermission() {
        when(guard.enter(any())).thenReturn(grant(TestPrincipals.scope(TestPrincipals.user("tenant_admin"))));

        interceptor.interceptCall(call, headers("tsk_key"), (c, h) -> new ServerCall.Listener<>() {});

        var request = ArgumentCaptor.forClass(AccessRequest.class);
        verify(guard).enter(request.capture());
        assertThat(request.getValue().permission()).isEqualTo(AUDIT_READ);
        assertThat(request.getValue().credential()).isEqualTo("tsk_key");
        assertThat(request.getValue().requestId()).isEqualTo("grpc-req-1");
        assertThat(request.getValue().transport()).isEqualTo("grpc");
    }

    @Test
    @DisplayName("binds the tenant scope around the handler start and every callback")
    void bindsScopeAroundCallbacks() {
        TenantScope scope = TestPrincipals.scope(TestPrincipals.user("tenant_admin"));
        when(guard.enter(any())).thenReturn(grant(scope));
        List<TenantScope> seen = new ArrayList<>();
        ServerCallHandler<String, String> next = (c, h) -> {
            seen.add(TenantScopes.current().orElse(null));
            return new ServerCall.Listener<>() {
                @Override
                public void onMessage(String message) {
                    seen.add(TenantScopes.current().orElse(null));
                }

                @Override
                public void onHalfClose() {
                    seen.add(TenantScopes.current().orElse(null));
                }
            };
        };

        ServerCall.Listener<String> listener = interceptor.interceptCall(call, headers("tsk_key"), next);
        assertThat(TenantScopes.current()).isEmpty();
        listener.onMessage("request");
        listener.onHalfClose();
        listener.onComplete();

        assertThat(seen).hasSize(3).containsOnly(scope);
        assertThat(TenantScopes.current()).isEmpty();
        verifyNoInteractions(audit);
    }

    @Test
    @DisplayName("audits a call the client cancels before completion")
    void auditsAbandonedCall() {
        TenantScope scope = TestPrincipals.scope(TestPrincipals.user("tenant_admin"));
        when(guard.enter(any())).thenReturn(grant(scope));

        ServerCall.Listener<String> listener =
                interceptor.interceptCall(call, headers("tsk_key"), (c, h) -> new ServerCall.Listener<>() {});
        listener.onCancel();

        var event = ArgumentCaptor.forClass(AuditEvent.class);
        verify(audit).record(event.capture());
        assertThat(event.getValue().action()).isEqualTo(AuditAction.REQUEST_ABANDONED);
        assertThat(event.getValue().tenantId()).isEqualTo(scope.tenantId());
        assertThat(event.getValue().resourceId()).isEqualTo(METHOD);
    }
}
