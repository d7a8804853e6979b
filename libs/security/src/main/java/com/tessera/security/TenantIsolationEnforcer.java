package com.tessera.security;

/**
 * Ties tenant-scoped records to the tenant of the current request.
 *
 * <p>WHY a utility class: every write path that handles tenant-scoped records must either stamp
 * the record with the request's tenant or prove it already carries it. Failing fast with {@link
 * TenantMismatchException} keeps foreign records from ever reaching storage.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that a record belongs to the context's tenant.
     *
     * @throws TenantMismatchException if the record is untagged or tagged with another tenant
     */
    public static <T extends TenantScoped<T>> T enforce(ResolvedTenantContext context, T record) {
        Long recordTenantKey = record.tenantKey();
        if (recordTenantKey == null || recordTenantKey != context.tenantKey()) {
            throw new TenantMismatchException(
                    context.tenantKey(), recordTenantKey == null ? -1L : recordTenantKey);
        }
        return record;
    }

    /**
     * Tags a new record with the context's tenant. A record that is already tagged must carry the
     * same tenant.
     *
     * @throws TenantMismatchException if the record is tagged with another tenant
     */
    public static <T extends TenantScoped<T>> T assign(ResolvedTenantContext context, T record) {
        if (record.tenantKey() == null) {
            return record.withTenantKey(context.tenantKey());
        }
        return enforce(context, record);
    }
}
