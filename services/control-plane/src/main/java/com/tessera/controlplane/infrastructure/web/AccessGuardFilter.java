package com.tessera.controlplane.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.security.credential.CredentialExtractor;
import com.tessera.security.error.ControlPlaneException;
import com.tessera.security.error.ErrorCode;
import com.tessera.security.error.ErrorEnvelopes;
import com.tessera.security.error.RateLimitExceededException;
import com.tessera.security.guard.AccessGrant;
import com.tessera.security.guard.AccessGuard;
import com.tessera.security.guard.AccessRequest;
import com.tessera.security.tenant.TenantHints;
import com.tessera.security.tenant.TenantScopes;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Admits {@code /api/**} requests through the {@link AccessGuard} and binds the resulting tenant
 * scope while the rest of the chain runs.
 *
 * <p>The credential comes from {@code Authorization: Bearer}, from {@code X-API-Key}, or on
 * WebSocket upgrades from the {@code access_token} query parameter. A rejected request never
 * reaches a controller: the error envelope is written here with the status of its error code, and
 * rate-limit rejections carry the {@code Retry-After} and {@code X-RateLimit-*} headers. Admitted
 * requests get the {@code X-RateLimit-*} headers too.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AccessGuardFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessGuardFilter.class);

    static final String GUARDED_PREFIX = "/api/";

    private final AccessGuard guard;
    private final ErrorEnvelopes envelopes;
    private final ObjectMapper mapper;

    public AccessGuardFilter(AccessGuard guard, ErrorEnvelopes envelopes, ObjectMapper mapper) {
        this.guard = guard;
        this.envelopes = envelopes;
        this.mapper = mapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith(GUARDED_PREFIX) || "OPTIONS".equals(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = RequestIdFilter.requestIdOf(request);
        AccessRequest accessRequest = AccessRequest.of(
                credentialOf(request),
                TenantHints.fromRequest(request.getHeader(TenantHints.TENANT_HEADER), request.getServerName()),
                ClientAddress.of(request),
                requestId,
                "http");

        AccessGrant grant;
        try {
            grant = guard.enter(accessRequest);
        } catch (ControlPlaneException e) {
            log.info("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.errorCode().code());
            reject(response, e, requestId);
            return;
        } catch (RuntimeException e) {
            log.error("Access check failed for {} {}", request.getMethod(), request.getRequestURI(), e);
            reject(response, e, requestId);
            return;
        }

        grant.rateLimit().headers().forEach(response::setHeader);
        try (TenantScopes.Binding ignored = TenantScopes.bind(grant.scope())) {
            filterChain.doFilter(request, response);
        }
    }

    private static String credentialOf(HttpServletRequest request) {
        String credential = CredentialExtractor.extract(
                        request.getHeader(HttpHeaders.AUTHORIZATION),
                        request.getHeader(CredentialExtractor.API_KEY_HEADER))
                .orElse(null);
        if (credential == null && "websocket".equalsIgnoreCase(request.getHeader(HttpHeaders.UPGRADE))) {
            credential = request.getParameter(CredentialExtractor.ACCESS_TOKEN_PARAMETER);
        }
        return credential;
    }

    private void reject(HttpServletResponse response, RuntimeException failure, String requestId)
            throws IOException {
        ErrorCode code = ErrorEnvelopes.codeOf(failure);
        if (failure instanceof RateLimitExceededException e) {
            e.headers().forEach(response::setHeader);
        }
        response.setStatus(code.httpStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        mapper.writeValue(response.getOutputStream(), envelopes.from(failure, requestId));
    }
}
