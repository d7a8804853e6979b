package com.tessera.tenancy.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * An isolated workspace.
 *
 * @param key internal surrogate key; never leaves the service
 * @param identifier external identifier used in routes and claims; immutable
 * @param name display name
 * @param description free-text description
 * @param createdAt creation time
 * @param active inactive tenants still resolve; the flag is informational
 */
public record Tenant(long key, UUID identifier, String name, String description, Instant createdAt, boolean active) {}
