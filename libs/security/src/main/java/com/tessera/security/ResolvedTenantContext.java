package com.tessera.security;

/**
 * The authorized tenant for one request: the tenant's internal key and the caller's role in it.
 *
 * <p>WHY a record: once published for a request it must not change, and it is passed explicitly
 * to the code that needs it rather than read from a mutable global. The internal key is a storage
 * detail and never leaves the service.
 *
 * @param tenantKey internal surrogate key of the tenant
 * @param role the caller's role in the tenant
 */
public record ResolvedTenantContext(long tenantKey, TenantRole role) {

    public ResolvedTenantContext {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    /** Checks the caller's role against a minimum, using the role hierarchy. */
    public boolean hasAtLeast(TenantRole minimum) {
        return role.meetsOrExceeds(minimum);
    }
}
