package com.tessera.tenancy.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tessera.database.retry.RetryProperties;
import com.tessera.database.retry.TransientFailureRetrier;
import com.tessera.observability.MetricFactory;
import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.ResolvedTenantContext;
import com.tessera.security.TenantRole;
import com.tessera.security.testing.TestCallers;
import com.tessera.tenancy.domain.Membership;
import com.tessera.tenancy.domain.MembershipStore;
import com.tessera.tenancy.domain.TenantStore;
import com.tessera.tenancy.domain.exception.DuplicateMembershipException;
import com.tessera.tenancy.domain.exception.InsufficientTenantRoleException;
import com.tessera.tenancy.domain.exception.LastOwnerException;
import com.tessera.tenancy.domain.exception.MembershipNotFoundException;
import com.tessera.tenancy.domain.exception.TenantAccessDeniedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Rules of the lifecycle service against mocked stores. Locking and the unique constraint
 * themselves are covered by {@link TenantLifecycleServiceIntegrationTest}.
 */
@DisplayName("TenantLifecycleService")
class TenantLifecycleServiceTest {

    private static final long TENANT = 7L;
    private static final ResolvedTenantContext OWNER = new ResolvedTenantContext(TENANT, TenantRole.OWNER);
    private static final ResolvedTenantContext EDITOR = new ResolvedTenantContext(TENANT, TenantRole.EDITOR);

    private final TenantStore tenants = mock(TenantStore.class);
    private final MembershipStore memberships = mock(MembershipStore.class);
    private final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
    private TenantLifecycleService service;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        when(tenants.lockForUpdate(TENANT)).thenReturn(true);
        var retrier = new TransientFailureRetrier(
                RetryProperties.defaults(), new MetricFactory(new SimpleMeterRegistry(), "test"), d -> { });
        service = new TenantLifecycleService(
                tenants,
                memberships,
                new UnrestrictedTenancyGateway(tenants, memberships, retrier),
                new TransactionTemplate(transactionManager),
                retrier);
    }

    @Nested
    @DisplayName("grantOrChangeRole")
    class Grant {

        @Test
        @DisplayName("creates a membership for a new member")
        void creates() {
            when(memberships.findRole("bob", TENANT)).thenReturn(Optional.empty());

            assertThat(service.grantOrChangeRole(OWNER, "bob", TenantRole.EDITOR)).isEqualTo(MembershipChange.CREATED);
            verify(memberships).insert(new Membership("bob", TENANT, TenantRole.EDITOR));
        }

        @Test
        @DisplayName("reports an identical role as unchanged")
        void unchanged() {
            when(memberships.findRole("bob", TENANT)).thenReturn(Optional.of(TenantRole.EDITOR));

            assertThat(service.grantOrChangeRole(OWNER, "bob", TenantRole.EDITOR))
                    .isEqualTo(MembershipChange.UNCHANGED);
            verify(memberships, never()).updateRole(anyString(), anyLong(), any());
        }

        @Test
        @DisplayName("reruns as an update when a concurrent grant inserted first")
        void concurrentInsertBecomesUpdate() {
            when(memberships.findRole("bob", TENANT))
                    .thenReturn(Optional.empty())
                    .thenReturn(Optional.of(TenantRole.VIEWER));
            doThrow(new DuplicateKeyException("uq_memberships_user_tenant"))
                    .when(memberships).insert(any());

            assertThat(service.grantOrChangeRole(OWNER, "bob", TenantRole.EDITOR)).isEqualTo(MembershipChange.UPDATED);
            verify(memberships).updateRole("bob", TENANT, TenantRole.EDITOR);
            verify(transactionManager).rollback(any());
        }

        @Test
        @DisplayName("gives up with a conflict when the rerun collides as well")
        void secondCollisionIsConflict() {
            when(memberships.findRole("bob", TENANT)).thenReturn(Optional.empty());
            doThrow(new DuplicateKeyException("uq_memberships_user_tenant"))
                    .when(memberships).insert(any());

            assertThatThrownBy(() -> service.grantOrChangeRole(OWNER, "bob", TenantRole.EDITOR))
                    .isInstanceOf(DuplicateMembershipException.class);
            verify(memberships, times(2)).insert(any());
        }

        @Test
        @DisplayName("refuses to demote the only Owner")
        void lastOwner() {
            when(memberships.findRole("alice", TENANT)).thenReturn(Optional.of(TenantRole.OWNER));
            when(memberships.countOwners(TENANT)).thenReturn(1);

            assertThatThrownBy(() -> service.grantOrChangeRole(OWNER, "alice", TenantRole.VIEWER))
                    .isInstanceOf(LastOwnerException.class);
            verify(memberships, never()).updateRole(anyString(), anyLong(), any());
        }

        @Test
        @DisplayName("demotes an Owner when another Owner remains")
        void demoteWithSecondOwner() {
            when(memberships.findRole("alice", TENANT)).thenReturn(Optional.of(TenantRole.OWNER));
            when(memberships.countOwners(TENANT)).thenReturn(2);

            assertThat(service.grantOrChangeRole(OWNER, "alice", TenantRole.VIEWER))
                    .isEqualTo(MembershipChange.UPDATED);
        }

        @Test
        @DisplayName("requires the Owner role")
        void requiresOwner() {
            assertThatThrownBy(() -> service.grantOrChangeRole(EDITOR, "bob", TenantRole.VIEWER))
                    .isInstanceOf(InsufficientTenantRoleException.class);
            verify(tenants, never()).lockForUpdate(anyLong());
        }

        @Test
        @DisplayName("reports a tenant deleted meanwhile as no access")
        void tenantGone() {
            when(tenants.lockForUpdate(TENANT)).thenReturn(false);

            assertThatThrownBy(() -> service.grantOrChangeRole(OWNER, "bob", TenantRole.VIEWER))
                    .isInstanceOf(TenantAccessDeniedException.class);
        }

        @Test
        @DisplayName("rejects a blank user id")
        void blankUser() {
            assertThatThrownBy(() -> service.grantOrChangeRole(OWNER, " ", TenantRole.VIEWER))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("rejects a user id longer than storage holds before touching it")
        void overlongUser() {
            String userId = "u".repeat(AuthenticatedCaller.MAX_USER_ID_LENGTH + 1);

            assertThatThrownBy(() -> service.grantOrChangeRole(OWNER, userId, TenantRole.VIEWER))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("255");
            verify(tenants, never()).lockForUpdate(anyLong());
            verify(memberships, never()).insert(any());
        }
    }

    @Nested
    @DisplayName("revokeRole")
    class Revoke {

        @Test
        @DisplayName("lets a member leave on their own")
        void selfRevoke() {
            when(memberships.findRole("bob", TENANT)).thenReturn(Optional.of(TenantRole.EDITOR));

            service.revokeRole(EDITOR, TestCallers.user("bob").build(), "bob");

            verify(memberships).delete("bob", TENANT);
        }

        @Test
        @DisplayName("forbids non-Owners to remove someone else")
        void othersNeedOwner() {
            assertThatThrownBy(() -> service.revokeRole(EDITOR, TestCallers.user("bob").build(), "carol"))
                    .isInstanceOf(InsufficientTenantRoleException.class);
        }

        @Test
        @DisplayName("forbids the last Owner to leave")
        void lastOwnerCannotLeave() {
            when(memberships.findRole("alice", TENANT)).thenReturn(Optional.of(TenantRole.OWNER));
            when(memberships.countOwners(TENANT)).thenReturn(1);

            assertThatThrownBy(() -> service.revokeRole(OWNER, TestCallers.user("alice").build(), "alice"))
                    .isInstanceOf(LastOwnerException.class);
            verify(memberships, never()).delete(anyString(), anyLong());
        }

        @Test
        @DisplayName("reports an unknown member")
        void unknownMember() {
            when(memberships.findRole("ghost", TENANT)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.revokeRole(OWNER, TestCallers.user("alice").build(), "ghost"))
                    .isInstanceOf(MembershipNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("tenant settings")
    class Settings {

        @Test
        @DisplayName("only an Owner may delete the tenant")
        void deleteNeedsOwner() {
            assertThatThrownBy(() -> service.deleteTenant(EDITOR)).isInstanceOf(InsufficientTenantRoleException.class);
            verify(tenants, never()).delete(anyLong());
        }

        @Test
        @DisplayName("deleting a tenant that is already gone is no access")
        void deleteMissing() {
            when(tenants.delete(TENANT)).thenReturn(false);

            assertThatThrownBy(() -> service.deleteTenant(OWNER)).isInstanceOf(TenantAccessDeniedException.class);
        }
    }
}
