package com.tessera.tenancy.domain.exception;

import com.tessera.security.TenantRole;

/**
 * The caller is a member of the tenant but holds a role below the one required.
 */
public class InsufficientTenantRoleException extends TenancyAccessDeniedException {

    private final TenantRole requiredRole;
    private final TenantRole heldRole;

    public InsufficientTenantRoleException(TenantRole requiredRole, TenantRole heldRole) {
        super("Role %s required, caller holds %s".formatted(requiredRole.claimName(), heldRole.claimName()));
        this.requiredRole = requiredRole;
        this.heldRole = heldRole;
    }

    public TenantRole requiredRole() {
        return requiredRole;
    }

    public TenantRole heldRole() {
        return heldRole;
    }
}
