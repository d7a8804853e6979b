package com.tessera.tenancy.service;

import com.tessera.security.ResolvedTenantContext;
import com.tessera.security.TenantScoped;
import com.tessera.tenancy.domain.TenantScopedStore;
import org.springframework.stereotype.Component;

/**
 * The only way to obtain a {@link TenantScopedGateway}: one is built per request from the
 * context resolved for it.
 */
@Component
public class TenantScopedGatewayFactory {

    public <T extends TenantScoped<T>, K> TenantScopedGateway<T, K> forContext(
            ResolvedTenantContext context, TenantScopedStore<T, K> store) {
        return new TenantScopedGateway<>(context, store);
    }
}
