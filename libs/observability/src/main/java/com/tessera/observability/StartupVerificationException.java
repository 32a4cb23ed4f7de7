package com.tessera.observability;

import java.util.List;

/**
 * Thrown when one or more required dependencies are unavailable at process start.
 */
public class StartupVerificationException extends IllegalStateException {

    private final transient List<DependencyStatus> failures;

    public StartupVerificationException(List<DependencyStatus> failures) {
        super("Required dependencies unavailable: " + failures.stream()
                .map(f -> f.name() + " (" + f.detail() + ")")
                .toList());
        this.failures = List.copyOf(failures);
    }

    /** The failing required dependencies. */
    public List<DependencyStatus> failures() {
        return failures;
    }
}
