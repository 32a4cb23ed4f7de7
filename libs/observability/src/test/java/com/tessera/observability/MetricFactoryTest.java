package com.tessera.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "control-plane");
    }

    @AfterEach
    void cleanup() {
        LogContextHolder.clear();
    }

    @Test
    @DisplayName("should reject null registry and blank service name")
    void shouldValidateArguments() {
        assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registry");
        assertThatThrownBy(() -> new MetricFactory(registry, " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }

    @Test
    @DisplayName("counter carries the service tag and extra tags")
    void counterCarriesTags() {
        Counter counter = factory.counter("tessera.auth.failures", "failures", "code", "invalid_token");
        counter.increment();

        Counter found = registry.get("tessera.auth.failures")
                .tag("service", "control-plane")
                .tag("code", "invalid_token")
                .counter();
        assertThat(found.count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("tenant counter reads the tenant from the bound log context")
    void tenantCounterUsesLogContext() {
        LogContextHolder.set(new LogContext("req-1", "acme", null, null));
        factory.tenantCounter("tessera.permission.denied", "denials").increment();
        LogContextHolder.clear();
        factory.tenantCounter("tessera.permission.denied", "denials").increment();

        assertThat(registry.get("tessera.permission.denied").tag("tenant", "acme").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("tessera.permission.denied").tag("tenant", MetricFactory.UNKNOWN_TENANT)
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("timer records durations")
    void timerRecords() {
        factory.timer("tessera.guard.duration", "guard").record(Duration.ofMillis(5));

        assertThat(registry.get("tessera.guard.duration").timer().count()).isEqualTo(1);
    }
}
