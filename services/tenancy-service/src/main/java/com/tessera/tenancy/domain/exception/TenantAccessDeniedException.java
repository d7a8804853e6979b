package com.tessera.tenancy.domain.exception;

/**
 * The caller has no access to the tenant at all.
 * <p>
 * Raised alike for "not a member", "tenant does not exist" and "tenant was deleted". The
 * reason is kept for logs only; the response never distinguishes them.
 */
public class TenantAccessDeniedException extends TenancyAccessDeniedException {

    /** Why access was denied. Internal only. */
    public enum Reason {
        NO_MEMBERSHIP,
        TENANT_NOT_FOUND
    }

    private final Reason reason;

    public TenantAccessDeniedException(Reason reason) {
        super("Access to tenant denied: " + reason);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
