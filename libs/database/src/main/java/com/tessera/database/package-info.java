/**
 * Storage support shared by Tessera services.
 *
 * <p>The tenancy schema itself lives in {@code db/migration/tessera} on the classpath and is
 * applied by Spring Boot's Flyway auto-configuration. This package holds the pieces that are not
 * SQL: bounded retries for transient storage failures.
 */
package com.tessera.database;
