package com.tessera.controlplane.infrastructure.web;

import com.tessera.observability.LogContext;
import com.tessera.observability.LogContextHolder;
import com.tessera.security.error.ControlPlaneException;
import com.tessera.security.error.ErrorCode;
import com.tessera.security.error.ErrorEnvelope;
import com.tessera.security.error.ErrorEnvelopes;
import com.tessera.security.error.RateLimitExceededException;
import com.tessera.security.error.ValidationException;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Renders every failure of a controller as an {@link ErrorEnvelope}.
 *
 * <pre>
 * {
 *   "error": "not_found",
 *   "message": "api_key not found: 3f2a...",
 *   "details": { "resource_type": "api_key", "resource_id": "3f2a..." },
 *   "request_id": "8c1e..."
 * }
 * </pre>
 *
 * <p>Typed control-plane failures keep their code and status. Request binding problems become
 * {@code validation_error}. Anything else is logged with its stack trace and answered with a
 * sanitized {@code internal_error}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final ErrorEnvelopes envelopes;

    public GlobalExceptionHandler(ErrorEnvelopes envelopes) {
        this.envelopes = envelopes;
    }

    @ExceptionHandler(ControlPlaneException.class)
    public ResponseEntity<ErrorEnvelope> handleControlPlane(ControlPlaneException ex) {
        ErrorCode code = ex.errorCode();
        if (code.httpStatus() >= 500) {
            log.error("Request failed: {}", code.code(), ex);
        } else {
            log.info("Request rejected: {} ({})", code.code(), ex.getMessage());
        }
        HttpHeaders headers = new HttpHeaders();
        if (ex instanceof RateLimitExceededException rateLimited) {
            rateLimited.headers().forEach(headers::set);
        }
        return ResponseEntity.status(code.httpStatus())
                .headers(headers)
                .body(envelopes.from(ex, currentRequestId()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorEnvelope> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, Object> fields = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(fe -> fields.putIfAbsent(fe.getField(), String.valueOf(fe.getDefaultMessage())));
        log.info("Validation failed: {}", fields.keySet());
        return handleControlPlane(new ValidationException("Request validation failed", fields));
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorEnvelope> handleBadRequest(Exception ex) {
        String message = ex instanceof HttpMessageNotReadableException
                ? "Request body is missing or malformed"
                : ex.getMessage();
        return handleControlPlane(new ValidationException(message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorEnvelope> handleGeneric(Exception ex) {
        if (ex instanceof ErrorResponse framework && framework.getStatusCode().is4xxClientError()) {
            return handleFramework(framework, ex);
        }
        String requestId = currentRequestId();
        log.error("Internal server error (request {})", requestId, ex);
        return ResponseEntity.status(ErrorCode.INTERNAL_ERROR.httpStatus())
                .body(envelopes.from(ex, requestId));
    }

    /** Unknown routes and unsupported methods keep their 4xx status. */
    private ResponseEntity<ErrorEnvelope> handleFramework(ErrorResponse framework, Exception ex) {
        int status = framework.getStatusCode().value();
        String code = status == 404 ? ErrorCode.NOT_FOUND.code() : ErrorCode.VALIDATION_ERROR.code();
        log.info("Request rejected by the framework: {} ({})", status, ex.getMessage());
        return ResponseEntity.status(status)
                .body(new ErrorEnvelope(code, ex.getMessage(), Map.of(), currentRequestId()));
    }

    private static String currentRequestId() {
        return TenantScopes.current()
                .map(TenantScope::requestId)
                .or(() -> LogContextHolder.get().map(LogContext::requestId))
                .orElseGet(() -> UUID.randomUUID().toString());
    }
}
