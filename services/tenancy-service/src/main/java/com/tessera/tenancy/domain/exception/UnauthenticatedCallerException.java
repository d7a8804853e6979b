package com.tessera.tenancy.domain.exception;

/**
 * The request carries no usable caller identity.
 */
public class UnauthenticatedCallerException extends TenancyException {

    public UnauthenticatedCallerException(String message) {
        super(message);
    }
}
