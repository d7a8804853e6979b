package com.tessera.tenancy.domain;

import com.tessera.security.TenantRole;

/**
 * A user's role in one tenant. At most one exists per (user, tenant).
 */
public record Membership(String userId, long tenantKey, TenantRole role) {}
