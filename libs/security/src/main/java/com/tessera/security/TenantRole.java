package com.tessera.security;

import java.util.Optional;

/**
 * Roles a user can hold within a single tenant.
 *
 * <p>WHY an explicit rank instead of {@code ordinal()}: the hierarchy is a strict total order
 * (VIEWER &lt; EDITOR &lt; OWNER) where each role can do everything the previous one can. Every
 * authorization decision goes through {@link #meetsOrExceeds(TenantRole)}, so the ordering lives
 * in exactly one place and does not depend on declaration order.
 *
 * <p>There is no "none" role. A user without a membership has no access at all, which is not the
 * same thing as being a viewer.
 */
public enum TenantRole {

    /** Can read tenant data. */
    VIEWER("Viewer", 1),

    /** Can read and write tenant data, but not manage the tenant or its members. */
    EDITOR("Editor", 2),

    /** Full control, including tenant settings and membership management. */
    OWNER("Owner", 3);

    private final String claimName;
    private final int rank;

    TenantRole(String claimName, int rank) {
        this.claimName = claimName;
        this.rank = rank;
    }

    /** The exact, case-sensitive name used in claims and policy names (e.g., "Editor"). */
    public String claimName() {
        return claimName;
    }

    /**
     * Checks whether this role satisfies a required minimum role.
     *
     * @param minimum the least powerful role that is acceptable
     * @return true if this role is the minimum or ranks above it
     */
    public boolean meetsOrExceeds(TenantRole minimum) {
        if (minimum == null) {
            throw new IllegalArgumentException("minimum role must not be null");
        }
        return rank >= minimum.rank;
    }

    /**
     * Looks up a role by its claim name. Matching is exact: "editor" and "EDITOR" are unknown.
     *
     * @param claimName the name to match
     * @return the matching role, or empty if the name is unknown
     */
    public static Optional<TenantRole> fromClaimName(String claimName) {
        for (TenantRole role : values()) {
            if (role.claimName.equals(claimName)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
