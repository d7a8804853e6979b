package com.tessera.tenancy.domain;

import com.tessera.security.TenantScoped;

import java.util.List;
import java.util.Optional;

/**
 * Storage port for a tenant-scoped record type.
 * <p>
 * Every operation takes the tenant key explicitly and must filter on it. Implementations are
 * only called through {@link com.tessera.tenancy.service.TenantScopedGateway}, which supplies
 * the key of the resolved tenant.
 *
 * @param <T> record type
 * @param <K> external key type of the record
 */
public interface TenantScopedStore<T extends TenantScoped<T>, K> {

    List<T> findAll(long tenantKey);

    Optional<T> find(long tenantKey, K key);

    /** Inserts a record already tagged with {@code tenantKey}. */
    T insert(long tenantKey, T record);

    /**
     * Updates the record's fields. The tenant column is never written.
     *
     * @return false if no record with that key exists in the tenant
     */
    boolean update(long tenantKey, T record);

    /** @return false if no record with that key exists in the tenant */
    boolean delete(long tenantKey, K key);
}
