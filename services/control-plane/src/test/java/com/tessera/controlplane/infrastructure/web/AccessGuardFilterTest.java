package com.tessera.controlplane.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.security.error.AuthenticationException;
import com.tessera.security.error.ErrorEnvelopes;
import com.tessera.security.error.RateLimitExceededException;
import com.tessera.security.guard.AccessGrant;
import com.tessera.security.guard.AccessGuard;
import com.tessera.security.guard.AccessRequest;
import com.tessera.security.ratelimit.RateLimitDecision;
import com.tessera.security.ratelimit.RateLimitTier;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import com.tessera.security.testing.TestPrincipals;
import jakarta.servlet.FilterChain;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("AccessGuardFilter")
class AccessGuardFilterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private AccessGuard guard;
    private AccessGuardFilter filter;

    @BeforeEach
    void setUp() {
        guard = mock(AccessGuard.class);
        filter = new AccessGuardFilter(guard, new ErrorEnvelopes(false), mapper);
    }

    private static MockHttpServletRequest apiRequest(String path) {
        var request = new MockHttpServletRequest("GET", path);
        request.setAttribute(RequestIdFilter.REQUEST_ID_ATTRIBUTE, "req-1");
        return request;
    }

    private static AccessGrant grant(TenantScope scope) {
        var decision = new RateLimitDecision(true, 60, 59, Instant.parse("2026-01-01T00:01:00Z"), 0,
                RateLimitTier.DEFAULT);
        return new AccessGrant(scope, decision);
    }

    @Nested
    @DisplayName("admitted requests")
    class Admitted {

        @Test
        @DisplayName("binds the tenant scope while the chain runs")
        void bindsScope() throws Exception {
            TenantScope scope = TestPrincipals.scope(TestPrincipals.user("viewer"));
            when(guard.enter(any())).thenReturn(grant(scope));
            var seen = new AtomicReference<TenantScope>();
            FilterChain chain = (req, resp) -> seen.set(TenantScopes.current().orElse(null));

            filter.doFilter(apiRequest("/api/v1/tenant"), new MockHttpServletResponse(), chain);

            assertThat(seen.get()).isEqualTo(scope);
            assertThat(TenantScopes.current()).isEmpty();
        }

        @Test
        @DisplayName("sets the rate-limit headers")
        void setsRateLimitHeaders() throws Exception {
            when(guard.enter(any())).thenReturn(grant(TestPrincipals.scope(TestPrincipals.user("viewer"))));
            var response = new MockHttpServletResponse();

            filter.doFilter(apiRequest("/api/v1/tenant"), response, new MockFilterChain());

            assertThat(response.getHeader(RateLimitDecision.HEADER_LIMIT)).isEqualTo("60");
            assertThat(response.getHeader(RateLimitDecision.HEADER_REMAINING)).isEqualTo("59");
        }

        @Test
        @DisplayName("passes the credential, tenant header, client address and request id to the guard")
        void buildsAccessRequest() throws Exception {
            when(guard.enter(any())).thenReturn(grant(TestPrincipals.scope(TestPrincipals.user("viewer"))));
            var request = apiRequest("/api/v1/tenant");
            request.addHeader("X-API-Key", "tsk_abc");
            request.addHeader("X-Tenant-ID", "tenant-a");
            request.addHeader("X-Forwarded-For", "203.0.113.9");

            filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

            var captor = ArgumentCaptor.forClass(AccessRequest.class);
            verify(guard).enter(captor.capture());
            AccessRequest sent = captor.getValue();
            assertThat(sent.credential()).isEqualTo("tsk_abc");
            assertThat(sent.hints().headerTenantId()).isEqualTo("tenant-a");
            assertThat(sent.clientIp()).isEqualTo("203.0.113.9");
            assertThat(sent.requestId()).isEqualTo("req-1");
            assertThat(sent.transport()).isEqualTo("http");
        }

        @Test
        @DisplayName("reads access_token on WebSocket upgrades only")
        void readsAccessTokenOnUpgrade() throws Exception {
            when(guard.enter(any())).thenReturn(grant(TestPrincipals.scope(TestPrincipals.user("viewer"))));
            var upgrade = apiRequest("/api/v1/stream");
            upgrade.addHeader("Upgrade", "websocket");
            upgrade.setParameter("access_token", "token-from-query");
            var plain = apiRequest("/api/v1/stream");
            plain.setParameter("access_token", "token-from-query");

            filter.doFilter(upgrade, new MockHttpServletResponse(), new MockFilterChain());
            filter.doFilter(plain, new MockHttpServletResponse(), new MockFilterChain());

            var captor = ArgumentCaptor.forClass(AccessRequest.class);
            verify(guard, times(2)).enter(captor.capture());
            assertThat(captor.getAllValues().get(0).credential()).isEqualTo("token-from-query");
            assertThat(captor.getAllValues().get(1).credential()).isNull();
        }
    }

    @Nested
    @DisplayName("rejected requests")
    class Rejected {

        @Test
        @DisplayName("writes the envelope with the status of the error code and stops the chain")
        void writesEnvelope() throws Exception {
            when(guard.enter(any())).thenThrow(AuthenticationException.credentialRequired());
            var response = new MockHttpServletResponse();
            var chain = mock(FilterChain.class);

            filter.doFilter(apiRequest("/api/v1/tenant"), response, chain);

            assertThat(response.getStatus()).isEqualTo(401);
            JsonNode body = mapper.readTree(response.getContentAsString());
            assertThat(body.path("error").asText()).isEqualTo("invalid_token");
            assertThat(body.path("request_id").asText()).isEqualTo("req-1");
            verify(chain, never()).doFilter(any(), any());
        }

        @Test
        @DisplayName("adds Retry-After to rate-limit rejections")
        void addsRetryAfter() throws Exception {
            when(guard.enter(any())).thenThrow(new RateLimitExceededException(7,
                    Map.of(RateLimitDecision.HEADER_RETRY_AFTER, "7")));
            var response = new MockHttpServletResponse();

            filter.doFilter(apiRequest("/api/v1/tenant"), response, new MockFilterChain());

            assertThat(response.getStatus()).isEqualTo(429);
            assertThat(response.getHeader(RateLimitDecision.HEADER_RETRY_AFTER)).isEqualTo("7");
        }

        @Test
        @DisplayName("answers unexpected failures with a sanitized internal_error")
        void sanitizesUnexpectedFailure() throws Exception {
            when(guard.enter(any())).thenThrow(new IllegalStateException("connection pool exhausted"));
            var response = new MockHttpServletResponse();

            filter.doFilter(apiRequest("/api/v1/tenant"), response, new MockFilterChain());

            assertThat(response.getStatus()).isEqualTo(500);
            assertThat(response.getContentAsString())
                    .contains("internal_error")
                    .doesNotContain("connection pool");
        }
    }

    @Test
    @DisplayName("leaves paths outside /api/ and CORS preflights alone")
    void skipsUnguardedRequests() throws Exception {
        filter.doFilter(new MockHttpServletRequest("GET", "/actuator/health"),
                new MockHttpServletResponse(), new MockFilterChain());
        filter.doFilter(new MockHttpServletRequest("OPTIONS", "/api/v1/tenant"),
                new MockHttpServletResponse(), new MockFilterChain());

        verifyNoInteractions(guard);
    }
}
