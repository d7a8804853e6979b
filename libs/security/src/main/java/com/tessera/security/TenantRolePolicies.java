package com.tessera.security;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of tenant role policies, one per role, keyed by policy name.
 *
 * <p>Built once at process start. Lookups by an unregistered name indicate a wiring bug in a
 * handler declaration, not a caller error.
 */
public final class TenantRolePolicies {

    private final Map<String, TenantRolePolicy> policies;

    private TenantRolePolicies(Map<String, TenantRolePolicy> policies) {
        this.policies = Collections.unmodifiableMap(policies);
    }

    /** Registers {@code TenantRole_Viewer}, {@code TenantRole_Editor} and {@code TenantRole_Owner}. */
    public static TenantRolePolicies registerAll() {
        Map<String, TenantRolePolicy> byName = new LinkedHashMap<>();
        for (TenantRole role : TenantRole.values()) {
            String name = TenantRolePolicy.nameFor(role);
            byName.put(name, new TenantRolePolicy(name, role));
        }
        return new TenantRolePolicies(byName);
    }

    /** Looks up a policy by name. */
    public Optional<TenantRolePolicy> find(String name) {
        return Optional.ofNullable(policies.get(name));
    }

    /**
     * Returns the policy with the given name.
     *
     * @throws IllegalStateException if no such policy was registered
     */
    public TenantRolePolicy require(String name) {
        return find(name)
                .orElseThrow(() -> new IllegalStateException("No tenant role policy registered as '" + name + "'"));
    }

    /** Returns the policy for a role. */
    public TenantRolePolicy forRole(TenantRole role) {
        return require(TenantRolePolicy.nameFor(role));
    }

    public Collection<TenantRolePolicy> all() {
        return policies.values();
    }
}
