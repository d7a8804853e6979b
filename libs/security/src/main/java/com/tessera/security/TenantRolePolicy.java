package com.tessera.security;

/**
 * A named authorization policy requiring a minimum tenant role.
 *
 * @param name policy key as seen by the routing layer, e.g. {@code TenantRole_Editor}
 * @param minimumRole the role the policy requires
 */
public record TenantRolePolicy(String name, TenantRole minimumRole) {

    /** Prefix shared by all tenant role policy names. */
    public static final String NAME_PREFIX = "TenantRole_";

    /** Builds the policy name for a role. */
    public static String nameFor(TenantRole role) {
        return NAME_PREFIX + role.claimName();
    }
}
