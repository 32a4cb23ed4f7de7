package com.tessera.controlplane.config;

import com.tessera.observability.MetricFactory;
import com.tessera.observability.SensitiveDataRedactor;
import com.tessera.observability.SpanHelper;
import com.tessera.security.error.ErrorEnvelopes;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cross-cutting beans: time, metrics, tracing, redaction, error rendering and the executor for
 * background writes (audit entries, API key usage).
 */
@Configuration
public class ObservabilityConfig {

    static final String INSTRUMENTATION_SCOPE = "com.tessera.controlplane";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ControlPlaneProperties properties) {
        return new MetricFactory(registry, properties.serviceName());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public ErrorEnvelopes errorEnvelopes(ControlPlaneProperties properties) {
        return ErrorEnvelopes.forEnvironment(properties.environment());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService backgroundExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "tessera-background-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(2, threads);
    }
}
