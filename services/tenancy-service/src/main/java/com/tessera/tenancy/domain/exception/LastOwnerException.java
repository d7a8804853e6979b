package com.tessera.tenancy.domain.exception;

/**
 * A membership change would leave the tenant without an Owner.
 */
public class LastOwnerException extends TenancyException {

    public LastOwnerException(String userId) {
        super("User '%s' is the last Owner of this tenant; assign another Owner first or delete the tenant"
                .formatted(userId));
    }
}
