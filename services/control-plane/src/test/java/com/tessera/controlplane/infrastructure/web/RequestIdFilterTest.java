package com.tessera.controlplane.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.tessera.observability.LogContext;
import com.tessera.observability.LogContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("RequestIdFilter")
class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @AfterEach
    void cleanup() {
        LogContextHolder.clear();
    }

    @Test
    @DisplayName("generates a request id when none is sent")
    void generatesRequestId() throws Exception {
        var request = new MockHttpServletRequest();
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        String requestId = response.getHeader(RequestIdFilter.REQUEST_ID_HEADER);
        assertThat(requestId).isNotBlank();
        assertThat(RequestIdFilter.requestIdOf(request)).isEqualTo(requestId);
    }

    @Test
    @DisplayName("keeps a well-formed request id from the client")
    void keepsClientRequestId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "client-abc.123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("client-abc.123");
    }

    @Test
    @DisplayName("replaces a request id that could inject into logs")
    void replacesMalformedRequestId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "abc\nforged log line");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER))
                .isNotBlank()
                .doesNotContain("forged");
    }

    @Test
    @DisplayName("exposes the id in the log context while the chain runs and clears it afterwards")
    void bindsLogContextDuringChain() throws Exception {
        var captured = new AtomicReference<String>();
        FilterChain chain = (req, resp) ->
                captured.set(LogContextHolder.get().map(LogContext::requestId).orElse(null));
        var request = new MockHttpServletRequest();
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, "during-chain");

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(captured.get()).isEqualTo("during-chain");
        assertThat(LogContextHolder.get()).isEmpty();
    }
}
