package com.tessera.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs all registered {@link DependencyCheck}s concurrently before the process accepts traffic.
 * <p>
 * A dependency is registered as either required or optional. {@link #verify()} throws
 * {@link StartupVerificationException} if any required dependency is unavailable or does not
 * answer within the timeout; unavailable optional dependencies are only logged.
 */
public final class StartupVerifier {

    private static final Logger log = LoggerFactory.getLogger(StartupVerifier.class);

    /** Default timeout for an individual probe (5 seconds). */
    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private record Registration(DependencyCheck check, boolean required) {
    }

    private final Map<String, Registration> checks = new LinkedHashMap<>();
    private final long timeoutMs;

    public StartupVerifier() {
        this(DEFAULT_TIMEOUT_MS);
    }

    /**
     * @param timeoutMs timeout in milliseconds for each individual probe
     */
    public StartupVerifier(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Registers a dependency whose unavailability must stop the process.
     */
    public StartupVerifier require(String name, DependencyCheck check) {
        return register(name, check, true);
    }

    /**
     * Registers a dependency that may be absent; failures are logged as warnings.
     */
    public StartupVerifier optional(String name, DependencyCheck check) {
        return register(name, check, false);
    }

    private synchronized StartupVerifier register(String name, DependencyCheck check, boolean required) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (check == null) {
            throw new IllegalArgumentException("check must not be null");
        }
        checks.put(name, new Registration(check, required));
        return this;
    }

    /**
     * Probes every registered dependency and returns the individual results in registration order.
     *
     * @throws StartupVerificationException if a required dependency is unavailable
     */
    public synchronized List<DependencyStatus> verify() {
        Map<String, CompletableFuture<DependencyStatus>> futures = new LinkedHashMap<>();
        for (Map.Entry<String, Registration> entry : checks.entrySet()) {
            futures.put(entry.getKey(), startProbe(entry.getKey(), entry.getValue().check()));
        }

        List<DependencyStatus> results = new ArrayList<>();
        List<DependencyStatus> failures = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<DependencyStatus>> entry : futures.entrySet()) {
            String name = entry.getKey();
            DependencyStatus status;
            try {
                status = entry.getValue()
                        .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                        .join();
            } catch (Exception e) {
                status = DependencyStatus.unavailable(name, "timeout or error: " + rootMessage(e), timeoutMs);
            }
            results.add(status);

            if (status.available()) {
                log.info("Dependency {} available ({} ms)", name, status.latencyMs());
            } else if (checks.get(name).required()) {
                log.error("Required dependency {} unavailable: {}", name, status.detail());
                failures.add(status);
            } else {
                log.warn("Optional dependency {} unavailable: {}", name, status.detail());
            }
        }

        if (!failures.isEmpty()) {
            throw new StartupVerificationException(failures);
        }
        return results;
    }

    /**
     * Returns the number of registered checks.
     */
    public synchronized int size() {
        return checks.size();
    }

    private static CompletableFuture<DependencyStatus> startProbe(String name, DependencyCheck check) {
        try {
            CompletableFuture<DependencyStatus> future = check.probe();
            if (future == null) {
                return CompletableFuture.completedFuture(
                        DependencyStatus.unavailable(name, "probe returned no result", 0));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
