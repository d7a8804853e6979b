package com.tessera.tenancy.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body for creating or updating a tenant.
 *
 * @param active only honoured on update; null keeps the current value
 */
public record TenantRequest(
        @NotBlank @Size(max = 100) String name,
        @NotBlank @Size(max = 500) String description,
        Boolean active) {}
