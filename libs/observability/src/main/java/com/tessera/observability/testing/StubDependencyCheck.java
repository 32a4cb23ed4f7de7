package com.tessera.observability.testing;

import com.tessera.observability.DependencyCheck;
import com.tessera.observability.DependencyStatus;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Controllable {@link DependencyCheck} for tests: can be flipped between available and
 * unavailable and counts how often it was probed.
 */
public final class StubDependencyCheck implements DependencyCheck {

    private final String name;
    private final AtomicInteger probes = new AtomicInteger();
    private volatile boolean available;
    private volatile String detail;

    private StubDependencyCheck(String name, boolean available, String detail) {
        this.name = name;
        this.available = available;
        this.detail = detail;
    }

    /** Creates a check that reports the dependency as reachable. */
    public static StubDependencyCheck up(String name) {
        return new StubDependencyCheck(name, true, null);
    }

    /** Creates a check that reports the dependency as unreachable. */
    public static StubDependencyCheck down(String name, String detail) {
        return new StubDependencyCheck(name, false, detail);
    }

    @Override
    public CompletableFuture<DependencyStatus> probe() {
        probes.incrementAndGet();
        return CompletableFuture.completedFuture(available
                ? DependencyStatus.available(name, 0)
                : DependencyStatus.unavailable(name, detail, 0));
    }

    public void setAvailable(boolean available, String detail) {
        this.available = available;
        this.detail = detail;
    }

    public int probeCount() {
        return probes.get();
    }
}
