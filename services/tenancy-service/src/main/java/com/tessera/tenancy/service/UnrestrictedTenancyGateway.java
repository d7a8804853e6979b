package com.tessera.tenancy.service;

import com.tessera.database.retry.TransientFailureRetrier;
import com.tessera.security.AuthenticatedCaller;
import com.tessera.tenancy.domain.MembershipStore;
import com.tessera.tenancy.domain.Tenant;
import com.tessera.tenancy.domain.TenantStore;
import com.tessera.tenancy.domain.UserTenantMembership;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage reads that are not confined to one tenant.
 * <p>
 * Only two things may look across tenants: resolving a tenant identifier before any tenant
 * context exists, and listing the authenticated caller's own memberships. Both live here so
 * that global reads are easy to find and review. The membership listing takes the caller, not
 * a user id, so it cannot enumerate anyone else.
 */
@Component
public class UnrestrictedTenancyGateway {

    private final TenantStore tenants;
    private final MembershipStore memberships;
    private final TransientFailureRetrier retrier;

    public UnrestrictedTenancyGateway(TenantStore tenants, MembershipStore memberships, TransientFailureRetrier retrier) {
        this.tenants = tenants;
        this.memberships = memberships;
        this.retrier = retrier;
    }

    /** Looks a tenant up by its external identifier, retrying transient failures. */
    public Optional<Tenant> findTenant(UUID identifier) {
        return retrier.execute("tenant.lookup", () -> tenants.findByIdentifier(identifier));
    }

    /** Lists every tenant the caller belongs to, with the caller's role in each. */
    public List<UserTenantMembership> membershipsOf(AuthenticatedCaller caller) {
        if (caller == null) {
            throw new IllegalArgumentException("caller must not be null");
        }
        return retrier.execute("membership.list-for-user", () -> memberships.findByUser(caller.userId()));
    }
}
