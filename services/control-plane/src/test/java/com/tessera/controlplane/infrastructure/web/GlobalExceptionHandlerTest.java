package com.tessera.controlplane.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.tessera.observability.LogContext;
import com.tessera.observability.LogContextHolder;
import com.tessera.security.error.ConflictException;
import com.tessera.security.error.ErrorEnvelope;
import com.tessera.security.error.ErrorEnvelopes;
import com.tessera.security.error.NotFoundException;
import com.tessera.security.error.RateLimitExceededException;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import com.tessera.security.testing.TestPrincipals;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.servlet.NoHandlerFoundException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(new ErrorEnvelopes(false));

    @AfterEach
    void cleanup() {
        LogContextHolder.clear();
    }

    @Test
    @DisplayName("keeps the status and code of control-plane failures")
    void mapsControlPlaneException() {
        ResponseEntity<ErrorEnvelope> result = handler.handleControlPlane(new NotFoundException("api_key", "k1"));

        assertThat(result.getStatusCode().value()).isEqualTo(404);
        assertThat(result.getBody().error()).isEqualTo("not_found");
        assertThat(result.getBody().message()).contains("k1");
    }

    @Test
    @DisplayName("maps conflicts to 409")
    void mapsConflict() {
        ResponseEntity<ErrorEnvelope> result =
                handler.handleControlPlane(new ConflictException("API key k1 is already revoked"));

        assertThat(result.getStatusCode().value()).isEqualTo(409);
        assertThat(result.getBody().error()).isEqualTo("conflict");
    }

    @Test
    @DisplayName("copies rate-limit headers onto 429 responses")
    void copiesRateLimitHeaders() {
        var failure = new RateLimitExceededException(3, Map.of("Retry-After", "3"));

        ResponseEntity<ErrorEnvelope> result = handler.handleControlPlane(failure);

        assertThat(result.getStatusCode().value()).isEqualTo(429);
        assertThat(result.getHeaders().getFirst("Retry-After")).isEqualTo("3");
    }

    @Test
    @DisplayName("answers malformed arguments with validation_error")
    void mapsIllegalArgument() {
        ResponseEntity<ErrorEnvelope> result =
                handler.handleBadRequest(new IllegalArgumentException("'to' must not be before 'from'"));

        assertThat(result.getStatusCode().value()).isEqualTo(400);
        assertThat(result.getBody().error()).isEqualTo("validation_error");
    }

    @Test
    @DisplayName("hides the details of unexpected failures")
    void sanitizesUnexpectedFailures() {
        ResponseEntity<ErrorEnvelope> result = handler.handleGeneric(new RuntimeException("jdbc:secret@db"));

        assertThat(result.getStatusCode().value()).isEqualTo(500);
        assertThat(result.getBody().error()).isEqualTo("internal_error");
        assertThat(result.getBody().message()).doesNotContain("secret");
        assertThat(result.getBody().details()).isEmpty();
    }

    @Test
    @DisplayName("keeps 4xx statuses raised by the framework")
    void keepsFrameworkClientErrors() {
        ResponseEntity<ErrorEnvelope> notFound =
                handler.handleGeneric(new NoHandlerFoundException("GET", "/api/v1/nothing", new HttpHeaders()));
        ResponseEntity<ErrorEnvelope> notAllowed =
                handler.handleGeneric(new HttpRequestMethodNotSupportedException("PATCH"));

        assertThat(notFound.getStatusCode().value()).isEqualTo(404);
        assertThat(notFound.getBody().error()).isEqualTo("not_found");
        assertThat(notAllowed.getStatusCode().value()).isEqualTo(405);
        assertThat(notAllowed.getBody().error()).isEqualTo("validation_error");
    }

    @Test
    @DisplayName("takes the request id from the bound tenant scope")
    void usesScopeRequestId() {
        TenantScope scope = TestPrincipals.scope(TestPrincipals.user("viewer"));

        ResponseEntity<ErrorEnvelope> result;
        try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
            result = handler.handleControlPlane(new NotFoundException("api_key", "k1"));
        }

        assertThat(result.getBody().requestId()).isEqualTo(scope.requestId());
    }

    @Test
    @DisplayName("falls back to the request id of the log context")
    void usesLogContextRequestId() {
        LogContextHolder.set(LogContext.forRequest("from-log-context"));

        ResponseEntity<ErrorEnvelope> result = handler.handleGeneric(new RuntimeException("boom"));

        assertThat(result.getBody().requestId()).isEqualTo("from-log-context");
    }
}
