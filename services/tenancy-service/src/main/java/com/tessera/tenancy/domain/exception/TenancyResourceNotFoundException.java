package com.tessera.tenancy.domain.exception;

/**
 * A sub-resource of an accessible tenant does not exist.
 */
public abstract class TenancyResourceNotFoundException extends TenancyException {

    private final String resourceType;

    protected TenancyResourceNotFoundException(String resourceType, String message) {
        super(message);
        this.resourceType = resourceType;
    }

    public String resourceType() {
        return resourceType;
    }
}
