package com.tessera.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Factory for Micrometer meters that share a consistent naming and tagging scheme.
 * <p>
 * Every meter carries a {@code service} tag. Meters obtained through the {@code tenant*} variants
 * also carry a {@code tenant} tag read from the current {@link LogContextHolder}; outside a bound
 * request the tag value is {@value #UNKNOWN_TENANT}.
 * <p>
 * Micrometer caches meters by name and tags, so calling these methods per request is cheap.
 */
public final class MetricFactory {

    /** Tag key for tenant segmentation. */
    public static final String TAG_TENANT = "tenant";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tenant tag value used when no request is bound. */
    public static final String UNKNOWN_TENANT = "none";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns a counter tagged with the service name and the given extra tags.
     *
     * @param name        metric name (e.g., "tessera.auth.failures")
     * @param description human-readable description
     * @param tags        additional tags as key-value pairs
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns a counter that additionally carries the current tenant tag.
     */
    public Counter tenantCounter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags).and(TAG_TENANT, currentTenant()))
                .register(registry);
    }

    /**
     * Returns a timer tagged with the service name and the given extra tags.
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Returns the service name used as a default tag.
     */
    public String serviceName() {
        return serviceName;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }

    private static String currentTenant() {
        return LogContextHolder.get()
                .map(LogContext::tenantId)
                .orElse(UNKNOWN_TENANT);
    }
}
