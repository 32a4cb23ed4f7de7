package com.tessera.security.secrets;

import com.tessera.observability.DependencyCheck;
import com.tessera.observability.DependencyStatus;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Start-up check that the secret store is reachable and holds every required secret. Missing
 * secrets are reported by name only.
 */
public final class SecretStoreCheck implements DependencyCheck {

    public static final String NAME = "secret-store";

    private final SecretStore store;
    private final List<String> requiredSecrets;

    public SecretStoreCheck(SecretStore store, List<String> requiredSecrets) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
        this.requiredSecrets = requiredSecrets == null ? List.of() : List.copyOf(requiredSecrets);
    }

    @Override
    public CompletableFuture<DependencyStatus> probe() {
        long start = System.nanoTime();
        if (!store.isReachable()) {
            return CompletableFuture.completedFuture(
                    DependencyStatus.unavailable(NAME, "secret store unreachable", elapsedMs(start)));
        }
        List<String> missing = requiredSecrets.stream()
                .filter(secret -> store.get(secret).filter(value -> !value.isBlank()).isEmpty())
                .toList();
        long latency = elapsedMs(start);
        DependencyStatus status = missing.isEmpty()
                ? DependencyStatus.available(NAME, latency)
                : DependencyStatus.unavailable(NAME, "missing secrets: " + String.join(", ", missing), latency);
        return CompletableFuture.completedFuture(status);
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
