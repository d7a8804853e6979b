package com.tessera.tenancy.domain;

import com.tessera.security.TenantRole;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for memberships.
 */
public interface MembershipStore {

    Optional<TenantRole> findRole(String userId, long tenantKey);

    /**
     * Inserts a membership.
     *
     * @throws org.springframework.dao.DuplicateKeyException if one already exists for the pair
     */
    void insert(Membership membership);

    /** @return false if no membership exists for the pair */
    boolean updateRole(String userId, long tenantKey, TenantRole role);

    /** @return false if no membership existed */
    boolean delete(String userId, long tenantKey);

    int countOwners(long tenantKey);

    List<Membership> findByTenant(long tenantKey);

    /** Every membership of a user, across all tenants. */
    List<UserTenantMembership> findByUser(String userId);
}
