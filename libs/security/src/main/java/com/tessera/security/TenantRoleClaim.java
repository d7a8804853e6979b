package com.tessera.security;

import java.util.UUID;

/**
 * One tenant membership as asserted by the caller: a tenant identifier and a role.
 *
 * <p>Wire format of the claim value is {@code "<tenant-identifier>:<RoleName>"}, carried in a
 * claim of type {@value #CLAIM_TYPE}. Encoding and parsing are exact inverses for every valid
 * membership; parsing rejects anything else rather than guessing.
 *
 * @param tenantIdentifier the tenant's external identifier
 * @param role the role held in that tenant
 */
public record TenantRoleClaim(UUID tenantIdentifier, TenantRole role) {

    /** Claim type carrying tenant memberships. */
    public static final String CLAIM_TYPE = "tenant_role";

    private static final char DELIMITER = ':';

    public TenantRoleClaim {
        if (tenantIdentifier == null) {
            throw new IllegalArgumentException("tenantIdentifier must not be null");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
    }

    /** Encodes this claim to its wire value, e.g. {@code "6f1c...-...:Editor"}. */
    public String encode() {
        return TenantIdentifiers.format(tenantIdentifier) + DELIMITER + role.claimName();
    }

    /**
     * Parses a claim value.
     *
     * @param value the raw claim value
     * @return the parsed claim
     * @throws ClaimFormatException if the delimiter count, identifier or role name is invalid
     */
    public static TenantRoleClaim parse(String value) {
        if (value == null) {
            throw new ClaimFormatException(null, "value is null");
        }
        int first = value.indexOf(DELIMITER);
        if (first < 0 || first != value.lastIndexOf(DELIMITER)) {
            throw new ClaimFormatException(value, "expected exactly one ':' delimiter");
        }
        String identifierPart = value.substring(0, first);
        String rolePart = value.substring(first + 1);

        UUID identifier =
                TenantIdentifiers.parse(identifierPart)
                        .orElseThrow(
                                () -> new ClaimFormatException(value, "unparseable tenant identifier"));
        TenantRole role =
                TenantRole.fromClaimName(rolePart)
                        .orElseThrow(
                                () -> new ClaimFormatException(value, "unknown role name '" + rolePart + "'"));
        return new TenantRoleClaim(identifier, role);
    }

    /**
     * Checks, without a full parse, whether a claim value names the given tenant. Used to find the
     * caller's claim for a tenant before deciding whether that claim is well-formed.
     */
    static boolean names(String value, UUID tenantIdentifier) {
        if (value == null) {
            return false;
        }
        int first = value.indexOf(DELIMITER);
        if (first < 0) {
            return false;
        }
        return TenantIdentifiers.parse(value.substring(0, first))
                .map(tenantIdentifier::equals)
                .orElse(false);
    }
}
