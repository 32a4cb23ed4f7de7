package com.tessera.controlplane.infrastructure.web;

import com.tessera.observability.LogContext;
import com.tessera.observability.LogContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Assigns every HTTP request its request id.
 *
 * <p>A well-formed {@code X-Request-ID} sent by the client is kept, otherwise a UUID is generated.
 * The id is put in the logging context, stored as a request attribute for later filters and echoed
 * in the response so callers can quote it. Runs before every other filter.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || !ACCEPTED.matcher(requestId).matches()) {
            requestId = UUID.randomUUID().toString();
        }

        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        LogContextHolder.set(LogContext.forRequest(requestId));
        try {
            filterChain.doFilter(request, response);
        } finally {
            LogContextHolder.clear();
        }
    }

    /**
     * The id assigned to {@code request}, or a fresh one if this filter did not run.
     */
    public static String requestIdOf(HttpServletRequest request) {
        Object value = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return value instanceof String id ? id : UUID.randomUUID().toString();
    }
}
