package com.tessera.tenancy.domain.exception;

/**
 * A handler asked for the tenant context, but none was resolved for the request. This is a
 * wiring error: the handler is missing its role requirement.
 */
public class TenantContextNotResolvedException extends TenancyException {

    public TenantContextNotResolvedException(String handler) {
        super("No tenant context was resolved for " + handler);
    }
}
