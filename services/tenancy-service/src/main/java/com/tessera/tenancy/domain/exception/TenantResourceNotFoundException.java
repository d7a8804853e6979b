package com.tessera.tenancy.domain.exception;

/**
 * A tenant-scoped record was not found in the resolved tenant.
 */
public class TenantResourceNotFoundException extends TenancyResourceNotFoundException {

    public TenantResourceNotFoundException(String resourceType, Object key) {
        super(resourceType, "%s '%s' not found".formatted(resourceType, key));
    }
}
