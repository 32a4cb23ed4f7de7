package com.tessera.security.tenant;

import com.tessera.observability.LogContext;
import com.tessera.observability.LogContextHolder;
import com.tessera.security.error.TenantException;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Binds a {@link TenantScope} to the thread that is executing a request.
 * <p>
 * The binding is acquired with {@link #bind(TenantScope)} in a try-with-resources block and is
 * released on every exit path, restoring whatever was bound before, so nested binds and pooled
 * threads are safe. While bound, the request, tenant and principal ids are also present in the
 * logging MDC.
 * <pre>{@code
 * try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
 *     handler.run();
 * }
 * }</pre>
 * Work handed to another thread must carry the scope explicitly, via {@link #wrap(Runnable)}
 * or {@link #wrap(Callable)}.
 */
public final class TenantScopes {

    private static final ThreadLocal<TenantScope> CURRENT = new ThreadLocal<>();

    private TenantScopes() {
    }

    /**
     * Binds {@code scope} to the current thread until the returned binding is closed.
     */
    public static Binding bind(TenantScope scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope must not be null");
        }
        Binding binding = new Binding(CURRENT.get(), LogContextHolder.get().orElse(null));
        CURRENT.set(scope);
        LogContextHolder.set(new LogContext(scope.requestId(), scope.tenantId(),
                scope.principal().id(), scope.principal().type().value()));
        return binding;
    }

    /**
     * The scope bound to the current thread, if any.
     */
    public static Optional<TenantScope> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * The scope bound to the current thread.
     *
     * @throws TenantException with {@code tenant_required} when nothing is bound
     */
    public static TenantScope require() {
        TenantScope scope = CURRENT.get();
        if (scope == null) {
            throw TenantException.required();
        }
        return scope;
    }

    /**
     * Captures the caller's scope (if any) and returns a task that runs under it on whichever
     * thread executes it.
     */
    public static Runnable wrap(Runnable task) {
        TenantScope captured = CURRENT.get();
        if (captured == null) {
            return task;
        }
        return () -> {
            try (Binding ignored = bind(captured)) {
                task.run();
            }
        };
    }

    /**
     * Callable variant of {@link #wrap(Runnable)}.
     */
    public static <T> Callable<T> wrap(Callable<T> task) {
        TenantScope captured = CURRENT.get();
        if (captured == null) {
            return task;
        }
        return () -> {
            try (Binding ignored = bind(captured)) {
                return task.call();
            }
        };
    }

    /**
     * Handle for one bind; closing it restores the previous binding. Must be closed on the thread
     * that created it. Closing twice is a no-op.
     */
    public static final class Binding implements AutoCloseable {

        private final TenantScope previous;
        private final LogContext previousLogContext;
        private final Thread owner = Thread.currentThread();
        private boolean closed;

        private Binding(TenantScope previous, LogContext previousLogContext) {
            this.previous = previous;
            this.previousLogContext = previousLogContext;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (Thread.currentThread() != owner) {
                throw new IllegalStateException("Tenant scope binding must be released on the thread that bound it");
            }
            closed = true;
            if (previous != null) {
                CURRENT.set(previous);
            } else {
                CURRENT.remove();
            }
            LogContextHolder.restore(previousLogContext);
        }
    }
}
