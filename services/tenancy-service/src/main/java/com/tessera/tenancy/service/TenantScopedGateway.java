package com.tessera.tenancy.service;

import com.tessera.security.ResolvedTenantContext;
import com.tessera.security.TenantIsolationEnforcer;
import com.tessera.security.TenantMismatchException;
import com.tessera.security.TenantScoped;
import com.tessera.tenancy.domain.TenantScopedStore;

import java.util.List;
import java.util.Optional;

/**
 * Data access for one tenant-scoped record type, confined to the resolved tenant.
 * <p>
 * A gateway is bound to a {@link ResolvedTenantContext} for its whole life. Reads see only the
 * context's tenant. Inserts tag records with it. Updates check the tag first. A record tagged
 * with any other tenant is rejected with {@link TenantMismatchException} before the store is
 * called.
 *
 * @param <T> record type
 * @param <K> external key type
 */
public final class TenantScopedGateway<T extends TenantScoped<T>, K> {

    private final ResolvedTenantContext context;
    private final TenantScopedStore<T, K> store;

    TenantScopedGateway(ResolvedTenantContext context, TenantScopedStore<T, K> store) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        this.context = context;
        this.store = store;
    }

    public List<T> readAll() {
        return store.findAll(context.tenantKey());
    }

    public Optional<T> read(K key) {
        return store.find(context.tenantKey(), key);
    }

    /**
     * Stores a new record under the context's tenant.
     *
     * @throws TenantMismatchException if the record already carries another tenant
     */
    public T insert(T record) {
        T tagged = TenantIsolationEnforcer.assign(context, record);
        return store.insert(context.tenantKey(), tagged);
    }

    /**
     * Updates an existing record. The tenant tag is checked, never rewritten.
     *
     * @return false if the record does not exist in this tenant
     * @throws TenantMismatchException if the record carries another tenant
     */
    public boolean update(T record) {
        T checked = TenantIsolationEnforcer.enforce(context, record);
        return store.update(context.tenantKey(), checked);
    }

    /** @return false if the record does not exist in this tenant */
    public boolean delete(K key) {
        return store.delete(context.tenantKey(), key);
    }

    public ResolvedTenantContext context() {
        return context;
    }
}
