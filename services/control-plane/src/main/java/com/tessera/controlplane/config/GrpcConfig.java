package com.tessera.controlplane.config;

import com.tessera.controlplane.infrastructure.grpc.GrpcAccessInterceptor;
import com.tessera.controlplane.infrastructure.grpc.GrpcExceptionInterceptor;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.error.ErrorEnvelopes;
import com.tessera.security.guard.AccessGuard;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Server interceptors for gRPC services. The server registers them with the exception interceptor
 * outermost, so failures of the access check and of the handler are both mapped.
 */
@Configuration
public class GrpcConfig {

    @Bean
    public GrpcAccessInterceptor grpcAccessInterceptor(
            AccessGuard accessGuard,
            AuditLedger auditLedger,
            ErrorEnvelopes errorEnvelopes,
            ControlPlaneProperties properties) {
        return new GrpcAccessInterceptor(
                accessGuard, auditLedger, errorEnvelopes, properties.grpc().permissionsByMethod());
    }

    @Bean
    public GrpcExceptionInterceptor grpcExceptionInterceptor(ErrorEnvelopes errorEnvelopes) {
        return new GrpcExceptionInterceptor(errorEnvelopes);
    }
}
