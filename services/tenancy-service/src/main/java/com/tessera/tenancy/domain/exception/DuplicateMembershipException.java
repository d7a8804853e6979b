package com.tessera.tenancy.domain.exception;

/**
 * A membership for the (user, tenant) pair could not be written because of a conflicting one.
 * Only raised when a retried grant still collides.
 */
public class DuplicateMembershipException extends TenancyException {

    public DuplicateMembershipException(String userId, Throwable cause) {
        super("Membership for user '%s' already exists".formatted(userId), cause);
    }
}
