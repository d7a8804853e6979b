package com.tessera.security;

/**
 * Thrown when a record tagged with one tenant is written under another tenant's context.
 *
 * <p>WHY a RuntimeException: this is a programming or security error, not a recoverable
 * condition. It is raised before any storage call is made.
 */
public class TenantMismatchException extends RuntimeException {

    private final long contextTenantKey;
    private final long recordTenantKey;

    public TenantMismatchException(long contextTenantKey, long recordTenantKey) {
        super("Tenant mismatch: context tenant %d cannot write a record of tenant %d"
                .formatted(contextTenantKey, recordTenantKey));
        this.contextTenantKey = contextTenantKey;
        this.recordTenantKey = recordTenantKey;
    }

    public long contextTenantKey() {
        return contextTenantKey;
    }

    public long recordTenantKey() {
        return recordTenantKey;
    }
}
