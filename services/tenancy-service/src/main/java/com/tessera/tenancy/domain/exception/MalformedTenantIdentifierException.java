package com.tessera.tenancy.domain.exception;

/**
 * The tenant identifier in the route does not parse.
 */
public class MalformedTenantIdentifierException extends TenancyException {

    private final String rawValue;

    public MalformedTenantIdentifierException(String rawValue) {
        super("Malformed tenant identifier '%s'".formatted(rawValue));
        this.rawValue = rawValue;
    }

    public String rawValue() {
        return rawValue;
    }
}
