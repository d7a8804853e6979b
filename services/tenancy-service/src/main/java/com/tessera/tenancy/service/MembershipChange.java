package com.tessera.tenancy.service;

/** What a grant did to the (user, tenant) membership. */
public enum MembershipChange {
    CREATED,
    UPDATED,
    UNCHANGED
}
