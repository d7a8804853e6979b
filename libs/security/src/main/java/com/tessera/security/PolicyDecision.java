package com.tessera.security;

import java.util.Optional;

/**
 * Outcome of evaluating a tenant role policy.
 *
 * @param outcome allow, or the specific reason for denial
 * @param grantedRole the caller's role in the tenant when a well-formed claim was found (present
 *     for {@link Outcome#ALLOW} and {@link Outcome#DENY_INSUFFICIENT_ROLE})
 */
public record PolicyDecision(Outcome outcome, Optional<TenantRole> grantedRole) {

    /** Why a policy evaluation ended the way it did. */
    public enum Outcome {
        /** The caller holds a role at or above the required minimum. */
        ALLOW,
        /** No usable claim for the tenant. Covers unknown tenants as well as non-members. */
        DENY_NO_MEMBERSHIP,
        /** The caller is a member but their role ranks below the required minimum. */
        DENY_INSUFFICIENT_ROLE
    }

    public PolicyDecision {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        grantedRole = grantedRole == null ? Optional.empty() : grantedRole;
    }

    public static PolicyDecision allow(TenantRole role) {
        return new PolicyDecision(Outcome.ALLOW, Optional.of(role));
    }

    public static PolicyDecision noMembership() {
        return new PolicyDecision(Outcome.DENY_NO_MEMBERSHIP, Optional.empty());
    }

    public static PolicyDecision insufficientRole(TenantRole role) {
        return new PolicyDecision(Outcome.DENY_INSUFFICIENT_ROLE, Optional.of(role));
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOW;
    }
}
