package com.tessera.tenancy.domain.exception;

/**
 * The caller may not perform the request in the addressed tenant.
 */
public abstract class TenancyAccessDeniedException extends TenancyException {

    protected TenancyAccessDeniedException(String message) {
        super(message);
    }
}
