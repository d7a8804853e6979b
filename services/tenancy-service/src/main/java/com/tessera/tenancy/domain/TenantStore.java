package com.tessera.tenancy.domain;

import java.util.Optional;
import java.util.UUID;

/**
 * Storage port for tenants.
 */
public interface TenantStore {

    /** Inserts a tenant and returns it with its generated key. */
    Tenant insert(UUID identifier, String name, String description, boolean active);

    Optional<Tenant> findByIdentifier(UUID identifier);

    Optional<Tenant> findByKey(long key);

    /**
     * Locks the tenant row until the surrounding transaction ends.
     *
     * @return false if the tenant no longer exists
     */
    boolean lockForUpdate(long key);

    /** @return false if the tenant no longer exists */
    boolean update(long key, String name, String description, boolean active);

    /** Deletes the tenant; memberships and tenant-scoped records go with it. */
    boolean delete(long key);
}
