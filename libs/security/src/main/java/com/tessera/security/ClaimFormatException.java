package com.tessera.security;

/**
 * Thrown when a {@code tenant_role} claim value cannot be parsed.
 *
 * <p>WHY a RuntimeException: a malformed claim is never silently defaulted to some role. The
 * caller either handles it explicitly (the policy evaluator treats it as "no access") or lets it
 * propagate.
 */
public class ClaimFormatException extends RuntimeException {

    private final String claimValue;

    public ClaimFormatException(String claimValue, String reason) {
        super("Malformed tenant_role claim '%s': %s".formatted(claimValue, reason));
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
