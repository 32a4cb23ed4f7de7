package com.tessera.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SpanHelper")
class SpanHelperTest {

    private InMemorySpanExporter spanExporter;
    private SpanHelper spanHelper;

    @BeforeEach
    void setUp() {
        spanExporter = InMemorySpanExporter.create();
        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(spanExporter))
                .build();
        OpenTelemetrySdk otelSdk = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .build();
        spanHelper = new SpanHelper(otelSdk.getTracer("test-tracer"));
    }

    @AfterEach
    void cleanup() {
        LogContextHolder.clear();
        spanExporter.reset();
    }

    @Test
    @DisplayName("should reject null tracer")
    void shouldRejectNullTracer() {
        assertThatThrownBy(() -> new SpanHelper(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should attach log context identifiers and custom attributes")
    void shouldAttachAttributes() {
        LogContextHolder.set(new LogContext("req-9", "acme", "user-1", "user"));

        String result = spanHelper.inSpan("access.enter", Map.of("transport", "http"), () -> "ok");

        assertThat(result).isEqualTo("ok");
        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getName()).isEqualTo("access.enter");
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.OK);
        assertThat(span.getAttributes().get(AttributeKey.stringKey("tenant.id"))).isEqualTo("acme");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("request.id"))).isEqualTo("req-9");
        assertThat(span.getAttributes().get(AttributeKey.stringKey("transport"))).isEqualTo("http");
    }

    @Test
    @DisplayName("should record the exception and rethrow it")
    void shouldRecordException() {
        assertThatThrownBy(() -> spanHelper.inSpan("access.enter", Map.of(), () -> {
            throw new IllegalStateException("denied");
        })).isInstanceOf(IllegalStateException.class).hasMessage("denied");

        SpanData span = spanExporter.getFinishedSpanItems().get(0);
        assertThat(span.getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        assertThat(span.getEvents()).isNotEmpty();
    }
}
