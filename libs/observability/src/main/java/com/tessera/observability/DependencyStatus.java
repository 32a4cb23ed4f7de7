package com.tessera.observability;

/**
 * Result of a single {@link DependencyCheck}.
 *
 * @param name      dependency name (e.g., "secret-store", "identity-provider")
 * @param available whether the dependency answered
 * @param detail    optional human-readable detail (error message when unavailable)
 * @param latencyMs time taken by the probe, in milliseconds
 */
public record DependencyStatus(String name, boolean available, String detail, long latencyMs) {

    /** Creates an available result. */
    public static DependencyStatus available(String name, long latencyMs) {
        return new DependencyStatus(name, true, null, latencyMs);
    }

    /** Creates an unavailable result. */
    public static DependencyStatus unavailable(String name, String detail, long latencyMs) {
        return new DependencyStatus(name, false, detail, latencyMs);
    }
}
