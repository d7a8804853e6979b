package com.tessera.tenancy.domain;

import com.tessera.security.TenantRole;

/**
 * One row of a user's cross-tenant membership listing.
 */
public record UserTenantMembership(Tenant tenant, TenantRole role) {}
