package com.tessera.security.tenant;

import com.tessera.observability.LogContext;
import com.tessera.security.credential.Principal;
import com.tessera.security.error.ErrorCode;
import com.tessera.security.error.TenantException;
import com.tessera.security.error.TenantMismatchException;
import com.tessera.security.testing.TestPrincipals;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TenantScopes")
class TenantScopesTest {

    @AfterEach
    void tearDown() {
        assertThat(TenantScopes.current()).as("no scope may leak out of a test").isEmpty();
        MDC.clear();
    }

    @Nested
    @DisplayName("bind()")
    class Bind {

        @Test
        @DisplayName("exposes the scope and the MDC keys while bound")
        void bindExposesScope() {
            TenantScope scope = TestPrincipals.scope(TestPrincipals.user("operator"));

            try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
                assertThat(TenantScopes.require()).isSameAs(scope);
                assertThat(MDC.get(LogContext.MDC_TENANT_ID)).isEqualTo(TestPrincipals.TENANT_ID);
                assertThat(MDC.get(LogContext.MDC_PRINCIPAL_ID)).isEqualTo(TestPrincipals.USER_ID);
                assertThat(MDC.get(LogContext.MDC_REQUEST_ID)).isEqualTo(scope.requestId());
            }

            assertThat(MDC.get(LogContext.MDC_TENANT_ID)).isNull();
        }

        @Test
        @DisplayName("restores the outer scope when a nested binding closes")
        void nestedRestore() {
            TenantScope outer = TestPrincipals.scope(TestPrincipals.user("operator"));
            TenantScope inner = TestPrincipals.scope(
                    TestPrincipals.userIn("u-2", TestPrincipals.OTHER_TENANT_ID, "viewer"));

            try (TenantScopes.Binding ignored = TenantScopes.bind(outer)) {
                try (TenantScopes.Binding nested = TenantScopes.bind(inner)) {
                    assertThat(TenantScopes.require().tenantId()).isEqualTo(TestPrincipals.OTHER_TENANT_ID);
                }
                assertThat(TenantScopes.require()).isSameAs(outer);
                assertThat(MDC.get(LogContext.MDC_TENANT_ID)).isEqualTo(TestPrincipals.TENANT_ID);
            }
        }

        @Test
        @DisplayName("releases the binding when the handler throws")
        void releasedOnException() {
            TenantScope scope = TestPrincipals.scope(TestPrincipals.user("operator"));

            assertThatThrownBy(() -> {
                try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
                    throw new IllegalStateException("boom");
                }
            }).isInstanceOf(IllegalStateException.class);

            assertThat(TenantScopes.current()).isEmpty();
        }

        @Test
        @DisplayName("closing twice is harmless")
        void closeTwice() {
            TenantScopes.Binding binding = TenantScopes.bind(TestPrincipals.scope(TestPrincipals.user()));
            binding.close();
            binding.close();

            assertThat(TenantScopes.current()).isEmpty();
        }

        @Test
        @DisplayName("must be released on the binding thread")
        void ownerThread() throws Exception {
            TenantScopes.Binding binding = TenantScopes.bind(TestPrincipals.scope(TestPrincipals.user()));
            AtomicReference<Throwable> failure = new AtomicReference<>();
            Thread other = new Thread(() -> {
                try {
                    binding.close();
                } catch (Throwable t) {
                    failure.set(t);
                }
            });
            other.start();
            other.join();
            binding.close();

            assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("require()")
    class Require {

        @Test
        @DisplayName("fails with tenant_required outside a binding")
        void unbound() {
            assertThatThrownBy(TenantScopes::require)
                    .isInstanceOf(TenantException.class)
                    .extracting(e -> ((TenantException) e).errorCode())
                    .isEqualTo(ErrorCode.TENANT_REQUIRED);
        }
    }

    @Nested
    @DisplayName("wrap()")
    class Wrap {

        @Test
        @DisplayName("carries the scope to an executor thread and leaves it clean")
        void carriesScope() throws Exception {
            TenantScope scope = TestPrincipals.scope(TestPrincipals.user("operator"));
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                Callable<String> task;
                try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
                    task = TenantScopes.wrap(() -> TenantScopes.require().tenantId());
                }
                Future<String> result = pool.submit(task);
                assertThat(result.get()).isEqualTo(TestPrincipals.TENANT_ID);

                Future<Boolean> leaked = pool.submit(() -> TenantScopes.current().isPresent());
                assertThat(leaked.get()).isFalse();
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("returns the task unchanged when nothing is bound")
        void nothingBound() {
            Runnable task = () -> { };

            assertThat(TenantScopes.wrap(task)).isSameAs(task);
        }
    }

    @Test
    @DisplayName("a scope cannot pair a tenant with a principal of another tenant")
    void scopeRejectsForeignPrincipal() {
        Principal foreign = TestPrincipals.userIn("u-9", TestPrincipals.OTHER_TENANT_ID, "viewer");

        assertThatThrownBy(() -> new TenantScope(TestPrincipals.tenant(TestPrincipals.TENANT_ID), foreign, "r-1"))
                .isInstanceOf(TenantMismatchException.class);
    }
}
