package com.tessera.tenancy.api.dto;

import com.tessera.tenancy.domain.Tenant;
import java.time.Instant;
import java.util.UUID;

/** A tenant as seen by API callers. The internal key is never included. */
public record TenantResponse(UUID identifier, String name, String description, Instant createdAt, boolean active) {

    public static TenantResponse from(Tenant tenant) {
        return new TenantResponse(
                tenant.identifier(), tenant.name(), tenant.description(), tenant.createdAt(), tenant.active());
    }
}
