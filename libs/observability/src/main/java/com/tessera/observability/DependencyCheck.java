package com.tessera.observability;

import java.util.concurrent.CompletableFuture;

/**
 * Probe for one external collaborator (secret store, identity provider, counter store).
 * <p>
 * Implementations perform a lightweight reachability check and complete the future with the
 * outcome. A probe that throws, or whose future completes exceptionally, counts as unavailable.
 */
@FunctionalInterface
public interface DependencyCheck {

    /**
     * Probes the dependency.
     *
     * @return a future completing with the dependency status
     */
    CompletableFuture<DependencyStatus> probe();
}
