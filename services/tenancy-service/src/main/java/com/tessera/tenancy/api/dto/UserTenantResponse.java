package com.tessera.tenancy.api.dto;

import com.tessera.tenancy.domain.UserTenantMembership;
import java.util.UUID;

/** One of the caller's tenants, with the caller's role in it. */
public record UserTenantResponse(UUID identifier, String name, String description, boolean active, String role) {

    public static UserTenantResponse from(UserTenantMembership membership) {
        var tenant = membership.tenant();
        return new UserTenantResponse(
                tenant.identifier(), tenant.name(), tenant.description(), tenant.active(), membership.role().claimName());
    }
}
