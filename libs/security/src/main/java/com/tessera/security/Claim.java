package com.tessera.security;

/**
 * A single typed claim from the caller's verified claim bundle.
 *
 * @param type claim type, e.g. {@value TenantRoleClaim#CLAIM_TYPE}
 * @param value opaque claim value
 */
public record Claim(String type, String value) {

    /** Convenience factory for a {@code tenant_role} claim carrying the given membership. */
    public static Claim tenantRole(TenantRoleClaim membership) {
        return new Claim(TenantRoleClaim.CLAIM_TYPE, membership.encode());
    }
}
