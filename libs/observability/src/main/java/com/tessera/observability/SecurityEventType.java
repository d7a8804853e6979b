package com.tessera.observability;

/**
 * Kinds of security-relevant events worth an audit line and a counter.
 */
public enum SecurityEventType {

    /** No caller identity was supplied, or it could not be decoded. */
    UNAUTHENTICATED("unauthenticated"),

    /** The route carried a tenant identifier that does not parse. */
    MALFORMED_TENANT_ID("malformed_tenant_id"),

    /** The caller has no usable membership, or the tenant does not exist. */
    TENANT_ACCESS_DENIED("tenant_access_denied"),

    /** The caller is a member, but their role is below what the route requires. */
    INSUFFICIENT_ROLE("insufficient_role"),

    /** Code attempted to write a record of one tenant under another tenant's context. */
    CROSS_TENANT_WRITE("cross_tenant_write"),

    /** A membership change was refused because it would leave a tenant without an Owner. */
    LAST_OWNER_PROTECTED("last_owner_protected");

    private final String tag;

    SecurityEventType(String tag) {
        this.tag = tag;
    }

    /** Value used for the {@code event} metric tag and the audit log line. */
    public String tag() {
        return tag;
    }
}
