package com.tessera.tenancy.domain.exception;

public class MembershipNotFoundException extends TenancyResourceNotFoundException {

    public MembershipNotFoundException(String userId) {
        super("Membership", "User '%s' is not a member of this tenant".formatted(userId));
    }
}
