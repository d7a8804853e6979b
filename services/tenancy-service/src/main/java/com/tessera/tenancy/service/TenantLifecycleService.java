package com.tessera.tenancy.service;

import com.tessera.database.retry.TransientFailureRetrier;
import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.ResolvedTenantContext;
import com.tessera.security.TenantRole;
import com.tessera.tenancy.domain.Membership;
import com.tessera.tenancy.domain.MembershipStore;
import com.tessera.tenancy.domain.Tenant;
import com.tessera.tenancy.domain.TenantStore;
import com.tessera.tenancy.domain.UserTenantMembership;
import com.tessera.tenancy.domain.exception.DuplicateMembershipException;
import com.tessera.tenancy.domain.exception.InsufficientTenantRoleException;
import com.tessera.tenancy.domain.exception.LastOwnerException;
import com.tessera.tenancy.domain.exception.MembershipNotFoundException;
import com.tessera.tenancy.domain.exception.TenantAccessDeniedException;
import com.tessera.tenancy.domain.exception.TenantAccessDeniedException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Creates, changes and retires tenants and memberships.
 * <p>
 * Every role-changing operation runs in one transaction that first locks the tenant row and
 * then re-reads the memberships it is about to change. Concurrent changes to the same tenant
 * therefore serialize, and the Owner count checked is the one that will be committed. A tenant
 * never loses its last Owner through a membership change; deleting the tenant is the way to
 * retire it.
 */
@Service
public class TenantLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TenantLifecycleService.class);

    private final TenantStore tenants;
    private final MembershipStore memberships;
    private final UnrestrictedTenancyGateway unrestricted;
    private final TransactionTemplate tx;
    private final TransientFailureRetrier retrier;

    public TenantLifecycleService(
            TenantStore tenants,
            MembershipStore memberships,
            UnrestrictedTenancyGateway unrestricted,
            TransactionTemplate tx,
            TransientFailureRetrier retrier) {
        this.tenants = tenants;
        this.memberships = memberships;
        this.unrestricted = unrestricted;
        this.tx = tx;
        this.retrier = retrier;
    }

    /**
     * Creates a tenant and makes the creator its Owner, atomically.
     */
    public Tenant createTenant(AuthenticatedCaller creator, String name, String description) {
        Tenant created = inTransaction(() -> {
            Tenant tenant = tenants.insert(UUID.randomUUID(), name, description, true);
            memberships.insert(new Membership(creator.userId(), tenant.key(), TenantRole.OWNER));
            return tenant;
        });
        log.info("Tenant {} created by {}", created.identifier(), creator.userId());
        return created;
    }

    /** Lists the caller's tenants with the caller's role in each. */
    public List<UserTenantMembership> listTenantsForUser(AuthenticatedCaller caller) {
        return unrestricted.membershipsOf(caller);
    }

    public Tenant getTenant(ResolvedTenantContext context) {
        return retrier.execute("tenant.get", () -> tenants.findByKey(context.tenantKey()))
                .orElseThrow(() -> new TenantAccessDeniedException(Reason.TENANT_NOT_FOUND));
    }

    /**
     * Updates the tenant's settings. Owner only.
     *
     * @param active new active flag, or null to keep the current one
     */
    public Tenant updateTenant(ResolvedTenantContext context, String name, String description, Boolean active) {
        requireOwner(context);
        return inTransaction(() -> {
            lockTenant(context);
            Tenant current = tenants.findByKey(context.tenantKey())
                    .orElseThrow(() -> new TenantAccessDeniedException(Reason.TENANT_NOT_FOUND));
            boolean newActive = active == null ? current.active() : active;
            tenants.update(current.key(), name, description, newActive);
            return new Tenant(current.key(), current.identifier(), name, description, current.createdAt(), newActive);
        });
    }

    /** Deletes the tenant together with its memberships and records. Owner only. */
    public void deleteTenant(ResolvedTenantContext context) {
        requireOwner(context);
        inTransaction(() -> {
            if (!tenants.delete(context.tenantKey())) {
                throw new TenantAccessDeniedException(Reason.TENANT_NOT_FOUND);
            }
            return null;
        });
        log.info("Tenant with key {} deleted", context.tenantKey());
    }

    public List<Membership> listMembers(ResolvedTenantContext context) {
        return retrier.execute("membership.list-for-tenant", () -> memberships.findByTenant(context.tenantKey()));
    }

    /**
     * Gives a user a role in the tenant, or changes the role they already have. Owner only.
     * <p>
     * If a concurrent grant inserts the same membership first, the unique constraint rejects
     * the second insert and the whole transaction is run again, this time as an update.
     *
     * @throws LastOwnerException if this would demote the tenant's only Owner
     */
    public MembershipChange grantOrChangeRole(ResolvedTenantContext context, String targetUserId, TenantRole role) {
        requireOwner(context);
        requireUserId(targetUserId);
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        MembershipChange change;
        try {
            change = inTransaction(() -> applyGrant(context, targetUserId, role));
        } catch (DuplicateKeyException first) {
            log.info("Concurrent grant for user {} detected, retrying as update", targetUserId);
            try {
                change = inTransaction(() -> applyGrant(context, targetUserId, role));
            } catch (DuplicateKeyException second) {
                throw new DuplicateMembershipException(targetUserId, second);
            }
        }
        log.info("Membership of {} {} with role {}", targetUserId, change, role.claimName());
        return change;
    }

    /**
     * Removes a user's membership. Allowed for an Owner, or for the user themselves.
     *
     * @throws LastOwnerException if the user is the tenant's only Owner
     * @throws MembershipNotFoundException if the user is not a member
     */
    public void revokeRole(ResolvedTenantContext context, AuthenticatedCaller caller, String targetUserId) {
        requireUserId(targetUserId);
        boolean self = targetUserId.equals(caller.userId());
        if (!self && !context.hasAtLeast(TenantRole.OWNER)) {
            throw new InsufficientTenantRoleException(TenantRole.OWNER, context.role());
        }
        inTransaction(() -> {
            lockTenant(context);
            TenantRole current = memberships.findRole(targetUserId, context.tenantKey())
                    .orElseThrow(() -> new MembershipNotFoundException(targetUserId));
            if (current == TenantRole.OWNER) {
                guardLastOwner(context, targetUserId);
            }
            memberships.delete(targetUserId, context.tenantKey());
            return null;
        });
        log.info("Membership of {} revoked{}", targetUserId, self ? " by the member" : "");
    }

    private MembershipChange applyGrant(ResolvedTenantContext context, String targetUserId, TenantRole role) {
        lockTenant(context);
        Optional<TenantRole> current = memberships.findRole(targetUserId, context.tenantKey());
        if (current.isEmpty()) {
            memberships.insert(new Membership(targetUserId, context.tenantKey(), role));
            return MembershipChange.CREATED;
        }
        if (current.get() == role) {
            return MembershipChange.UNCHANGED;
        }
        if (current.get() == TenantRole.OWNER) {
            guardLastOwner(context, targetUserId);
        }
        memberships.updateRole(targetUserId, context.tenantKey(), role);
        return MembershipChange.UPDATED;
    }

    private void guardLastOwner(ResolvedTenantContext context, String targetUserId) {
        if (memberships.countOwners(context.tenantKey()) <= 1) {
            throw new LastOwnerException(targetUserId);
        }
    }

    private void lockTenant(ResolvedTenantContext context) {
        if (!tenants.lockForUpdate(context.tenantKey())) {
            throw new TenantAccessDeniedException(Reason.TENANT_NOT_FOUND);
        }
    }

    private static void requireOwner(ResolvedTenantContext context) {
        if (!context.hasAtLeast(TenantRole.OWNER)) {
            throw new InsufficientTenantRoleException(TenantRole.OWNER, context.role());
        }
    }

    private static void requireUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        if (userId.length() > AuthenticatedCaller.MAX_USER_ID_LENGTH) {
            throw new IllegalArgumentException(
                    "userId must not exceed " + AuthenticatedCaller.MAX_USER_ID_LENGTH + " characters");
        }
    }

    private <T> T inTransaction(Supplier<T> work) {
        return tx.execute(status -> work.get());
    }
}
