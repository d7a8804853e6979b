package com.tessera.security;

/**
 * Capability implemented by every record type that belongs to exactly one tenant.
 *
 * <p>Tenant scoping is decided at compile time: a type either implements this interface or it is
 * not tenant-scoped. The tenant reference is assigned once, on creation, and ordinary updates
 * never change it.
 *
 * @param <T> the implementing record type
 */
public interface TenantScoped<T extends TenantScoped<T>> {

    /** The internal key of the owning tenant, or null before the record is first stored. */
    Long tenantKey();

    /** Returns a copy of this record tagged with the given tenant. */
    T withTenantKey(long tenantKey);
}
