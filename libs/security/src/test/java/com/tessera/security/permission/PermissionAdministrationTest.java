package com.tessera.security.permission;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.observability.SensitiveDataRedactor;
import com.tessera.security.audit.Actor;
import com.tessera.security.audit.AuditAction;
import com.tessera.security.audit.AuditLedger;
import com.tessera.security.audit.AuditLogEntry;
import com.tessera.security.audit.AuditQuery;
import com.tessera.security.error.NotFoundException;
import com.tessera.security.error.ValidationException;
import com.tessera.security.memory.InMemoryAuditLogStore;
import com.tessera.security.memory.InMemoryPermissionStore;
import com.tessera.security.testing.MutableClock;
import com.tessera.security.testing.TestPrincipals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionAdministration")
class PermissionAdministrationTest {

    private static final Permission TERMINATE = Permission.parse("sessions:terminate");
    private static final Actor ADMIN = Actor.of(TestPrincipals.userIn("admin-1", TestPrincipals.TENANT_ID,
            "tenant_admin"));

    private MutableClock clock;
    private InMemoryPermissionStore store;
    private AuditLedger audit;
    private PermissionAdministration administration;
    private PermissionResolver resolver;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        store = new InMemoryPermissionStore();
        new PermissionMatrixSeed(new ObjectMapper()).seedDefaults(store);
        audit = new AuditLedger(new InMemoryAuditLogStore(), clock, Runnable::run, new SensitiveDataRedactor());
        administration = new PermissionAdministration(store, audit, clock);
        resolver = new PermissionResolver(store, new ConditionEvaluator(), null, clock);
    }

    private List<AuditLogEntry> permissionChanges() {
        return audit.search(TestPrincipals.TENANT_ID,
                new AuditQuery(null, AuditAction.PERMISSION_CHANGE, null, null, null, null, 100));
    }

    @Test
    @DisplayName("an override changes the next decision and is audited")
    void overrideTakesEffect() {
        administration.overridePermission(TestPrincipals.TENANT_ID, "operator", TERMINATE, false, null, ADMIN);

        assertThat(resolver.check(TestPrincipals.user("operator"), TERMINATE, null).allowed()).isFalse();
        assertThat(permissionChanges()).singleElement().satisfies(e -> {
            assertThat(e.resourceId()).isEqualTo("operator/sessions:terminate");
            assertThat(e.newValues()).containsEntry("allowed", false);
            assertThat(e.oldValues()).isEmpty();
        });
    }

    @Test
    @DisplayName("replacing an override records the previous values")
    void replaceOverride() {
        administration.overridePermission(TestPrincipals.TENANT_ID, "operator", TERMINATE, false, null, ADMIN);
        clock.advance(Duration.ofMinutes(1));
        administration.overridePermission(TestPrincipals.TENANT_ID, "operator", TERMINATE, true, null, ADMIN);

        assertThat(administration.listOverrides(TestPrincipals.TENANT_ID)).hasSize(1);
        assertThat(permissionChanges().get(0).oldValues()).containsEntry("allowed", false);
    }

    @Test
    @DisplayName("removing an override restores the default; removing twice is not found")
    void removeOverride() {
        administration.overridePermission(TestPrincipals.TENANT_ID, "operator", TERMINATE, false, null, ADMIN);

        administration.removeOverride(TestPrincipals.TENANT_ID, "operator", TERMINATE, ADMIN);

        assertThat(resolver.check(TestPrincipals.user("operator"), TERMINATE, null).allowed()).isTrue();
        assertThatThrownBy(() -> administration.removeOverride(TestPrincipals.TENANT_ID, "operator", TERMINATE,
                ADMIN)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("rejects unknown roles")
    void unknownRole() {
        assertThatThrownBy(() -> administration.overridePermission(TestPrincipals.TENANT_ID, "wizard", TERMINATE,
                true, null, ADMIN)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> administration.assignRole(TestPrincipals.TENANT_ID, "user-2", "wizard", null,
                ADMIN)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("role assignments grant permissions until revoked")
    void assignAndRevoke() {
        administration.assignRole(TestPrincipals.TENANT_ID, TestPrincipals.USER_ID, "supervisor", null, ADMIN);
        Permission takeover = Permission.parse("sessions:takeover");

        assertThat(resolver.check(TestPrincipals.user("viewer"), takeover, null).allowed()).isTrue();

        administration.revokeRole(TestPrincipals.TENANT_ID, TestPrincipals.USER_ID, "supervisor", ADMIN);

        assertThat(resolver.check(TestPrincipals.user("viewer"), takeover, null).allowed()).isFalse();
        assertThat(permissionChanges()).hasSize(2);
        assertThatThrownBy(() -> administration.revokeRole(TestPrincipals.TENANT_ID, TestPrincipals.USER_ID,
                "supervisor", ADMIN)).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("an assignment cannot expire in the past")
    void pastExpiry() {
        assertThatThrownBy(() -> administration.assignRole(TestPrincipals.TENANT_ID, "user-2", "viewer",
                clock.instant().minusSeconds(1), ADMIN)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("lists a role's platform permissions sorted")
    void rolePermissions() {
        assertThat(administration.rolePermissions("billing_admin"))
                .containsExactly("analytics:export", "analytics:read", "billing:export", "billing:manage",
                        "billing:read", "notifications:read", "tenants:read");
    }

    @Test
    @DisplayName("a tenant admin cannot grant itself the platform admin role")
    void platformRoleNotAssignable() {
        Permission tenantManagement = Permission.parse("admin:tenant_management");

        assertThatThrownBy(() -> administration.assignRole(TestPrincipals.TENANT_ID, "admin-1", "saas_admin", null,
                ADMIN)).isInstanceOf(ValidationException.class);

        assertThat(administration.roleAssignments(TestPrincipals.TENANT_ID, "admin-1")).isEmpty();
        assertThat(resolver.check(TestPrincipals.userIn("admin-1", TestPrincipals.TENANT_ID, "tenant_admin"),
                tenantManagement, null).allowed()).isFalse();
        assertThat(permissionChanges()).isEmpty();
    }

    @Test
    @DisplayName("a tenant cannot override platform permissions or the platform admin role")
    void platformPermissionsNotOverridable() {
        Permission tenantManagement = Permission.parse("admin:tenant_management");

        assertThatThrownBy(() -> administration.overridePermission(TestPrincipals.OTHER_TENANT_ID, "tenant_admin",
                tenantManagement, true, null, ADMIN)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> administration.overridePermission(TestPrincipals.TENANT_ID, "saas_admin",
                TERMINATE, false, null, ADMIN)).isInstanceOf(ValidationException.class);

        assertThat(administration.listOverrides(TestPrincipals.OTHER_TENANT_ID)).isEmpty();
        assertThat(resolver.check(TestPrincipals.userIn("admin-2", TestPrincipals.OTHER_TENANT_ID, "tenant_admin"),
                tenantManagement, null).allowed()).isFalse();
    }
}
