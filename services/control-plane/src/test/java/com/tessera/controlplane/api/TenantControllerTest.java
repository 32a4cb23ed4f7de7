package com.tessera.controlplane.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.audit.AuditLogEntry;
import com.tessera.security.audit.AuditQuery;
import com.tessera.observability.SensitiveDataRedactor;
import com.tessera.security.credential.Principal;
import com.tessera.security.error.PermissionDeniedException;
import com.tessera.security.guard.PermissionGuard;
import com.tessera.security.memory.InMemoryAuditLogStore;
import com.tessera.security.memory.InMemoryTenantDirectory;
import com.tessera.security.tenant.TenantAdministration;
import com.tessera.security.tenant.TenantScope;
import com.tessera.security.tenant.TenantScopes;
import com.tessera.security.testing.MutableClock;
import com.tessera.security.testing.TestPrincipals;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

@DisplayName("TenantController")
class TenantControllerTest {

    private static final String PLATFORM_TENANT = "platform";

    private final PermissionGuard permissions = mock(PermissionGuard.class);
    private AuditLedger ledger;
    private TenantController controller;

    @BeforeEach
    void setUp() {
        InMemoryTenantDirectory directory = new InMemoryTenantDirectory();
        directory.save(TestPrincipals.tenant(PLATFORM_TENANT));
        directory.save(TestPrincipals.tenant(TestPrincipals.OTHER_TENANT_ID));
        ledger = new AuditLedger(new InMemoryAuditLogStore(), MutableClock.at("2026-03-01T10:00:00Z"),
                Runnable::run, new SensitiveDataRedactor());
        controller = new TenantController(
                new TenantAdministration(directory, ledger), ledger, new EndpointAccess(permissions));
    }

    @Test
    @DisplayName("records a platform read of another tenant in the reader's audit log")
    void auditsCrossTenantRead() {
        TenantScope scope = TestPrincipals.scope(
                TestPrincipals.userIn("ops-1", PLATFORM_TENANT, Principal.PLATFORM_ADMIN_ROLE));
        var request = new MockHttpServletRequest();
        request.setRemoteAddr("203.0.113.9");

        TenantController.TenantView view;
        try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
            view = controller.get(TestPrincipals.OTHER_TENANT_ID, request);
        }

        assertThat(view.id()).isEqualTo(TestPrincipals.OTHER_TENANT_ID);
        List<AuditLogEntry> entries = ledger.search(PLATFORM_TENANT,
                new AuditQuery(null, AuditAction.CROSS_TENANT_READ, null, null, null, null, 10));
        assertThat(entries).singleElement().satisfies(entry -> {
            assertThat(entry.actorId()).isEqualTo("ops-1");
            assertThat(entry.ipAddress()).isEqualTo("203.0.113.9");
            assertThat(entry.resourceType()).isEqualTo("tenant");
            assertThat(entry.resourceId()).isEqualTo(TestPrincipals.OTHER_TENANT_ID);
        });
        assertThat(ledger.search(TestPrincipals.OTHER_TENANT_ID, AuditQuery.all())).isEmpty();
    }

    @Test
    @DisplayName("records nothing when the read is denied")
    void deniedReadIsNotAudited() {
        TenantScope scope = TestPrincipals.scope(
                TestPrincipals.userIn("user-2", PLATFORM_TENANT, "tenant_admin"));
        doThrow(new PermissionDeniedException("admin:tenant_management"))
                .when(permissions).require(scope, TenantController.MANAGE_TENANTS, TestPrincipals.OTHER_TENANT_ID);

        try (TenantScopes.Binding ignored = TenantScopes.bind(scope)) {
            assertThatThrownBy(() -> controller.get(TestPrincipals.OTHER_TENANT_ID, new MockHttpServletRequest()))
                    .isInstanceOf(PermissionDeniedException.class);
        }

        assertThat(ledger.search(PLATFORM_TENANT, AuditQuery.all())).isEmpty();
    }
}
