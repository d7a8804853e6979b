/**
 * Domain layer: tenants, memberships, tenant-scoped records and the storage ports they need.
 *
 * <ul>
 *   <li>Domain MUST NOT depend on infrastructure or api packages
 *   <li>Storage is reached only through the port interfaces declared here
 *   <li>Internal tenant keys stay inside the service; the api layer exposes identifiers only
 * </ul>
 */
package com.tessera.tenancy.domain;
