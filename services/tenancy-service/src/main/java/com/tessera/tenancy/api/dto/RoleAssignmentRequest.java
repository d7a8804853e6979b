package com.tessera.tenancy.api.dto;

import com.tessera.security.TenantRole;
import jakarta.validation.constraints.NotBlank;

/**
 * Body for granting or changing a member's role.
 *
 * @param role role claim name: {@code Viewer}, {@code Editor} or {@code Owner}
 */
public record RoleAssignmentRequest(@NotBlank String role) {

    /** @throws IllegalArgumentException if the name is not a known role */
    public TenantRole toRole() {
        return TenantRole.fromClaimName(role)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role '" + role + "'"));
    }
}
