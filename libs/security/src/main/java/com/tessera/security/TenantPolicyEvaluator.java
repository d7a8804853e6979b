package com.tessera.security;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a caller's claims satisfy a minimum tenant role.
 *
 * <p>WHY a utility class: the decision is a pure function of (required role, tenant, claims). It
 * never touches storage and keeps no state, so it can be tested without a database and called
 * from any thread.
 */
public final class TenantPolicyEvaluator {

    private TenantPolicyEvaluator() {
        // utility class
    }

    /**
     * Evaluates a tenant role requirement.
     *
     * <p>The caller's {@code tenant_role} claims are scanned for the requested tenant. No claim
     * means no membership. A claim that names the tenant but does not parse is also treated as no
     * membership; it is never read as some default role.
     *
     * @param requiredMinimumRole the least powerful role that grants access
     * @param tenantIdentifier the tenant addressed by the request
     * @param tenantRoleClaims the caller's {@code tenant_role} claim values
     * @return the decision, carrying the caller's role when one was found
     */
    public static PolicyDecision evaluate(
            TenantRole requiredMinimumRole, UUID tenantIdentifier, List<String> tenantRoleClaims) {
        if (requiredMinimumRole == null || tenantIdentifier == null) {
            throw new IllegalArgumentException("requiredMinimumRole and tenantIdentifier are required");
        }

        Optional<TenantRoleClaim> claim = findClaim(tenantIdentifier, tenantRoleClaims);
        if (claim.isEmpty()) {
            return PolicyDecision.noMembership();
        }

        TenantRole role = claim.get().role();
        return role.meetsOrExceeds(requiredMinimumRole)
                ? PolicyDecision.allow(role)
                : PolicyDecision.insufficientRole(role);
    }

    /**
     * Finds the caller's well-formed claim for a tenant.
     *
     * <p>Only the first claim naming the tenant is considered, mirroring the one-membership-per-
     * tenant rule. If that claim is malformed the result is empty.
     */
    public static Optional<TenantRoleClaim> findClaim(
            UUID tenantIdentifier, List<String> tenantRoleClaims) {
        if (tenantRoleClaims == null) {
            return Optional.empty();
        }
        for (String value : tenantRoleClaims) {
            if (TenantRoleClaim.names(value, tenantIdentifier)) {
                try {
                    return Optional.of(TenantRoleClaim.parse(value));
                } catch (ClaimFormatException e) {
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }
}
