package com.tessera.security;

import java.util.ArrayList;

/**
 * Checks that a decoded {@link AuthenticatedCaller} is structurally usable.
 * <p>
 * WHY structural only: claim values are not parsed here. A malformed {@code tenant_role} value
 * must not reject the whole caller; it only denies access to the tenant it names, and that
 * decision belongs to {@link TenantPolicyEvaluator}.
 */
public final class CallerContextValidator {

    private CallerContextValidator() {
        // utility class
    }

    /**
     * Validates the caller and returns every problem found at once.
     */
    public static CallerValidationResult validate(AuthenticatedCaller caller) {
        var errors = new ArrayList<String>();

        if (caller == null) {
            errors.add("caller must not be null");
            return CallerValidationResult.fail(errors);
        }
        if (isBlank(caller.userId())) {
            errors.add("userId must not be null or blank");
        } else if (caller.userId().length() > AuthenticatedCaller.MAX_USER_ID_LENGTH) {
            errors.add("userId must not exceed " + AuthenticatedCaller.MAX_USER_ID_LENGTH + " characters");
        }
        for (int i = 0; i < caller.claims().size(); i++) {
            Claim claim = caller.claims().get(i);
            if (claim == null) {
                errors.add("claims[" + i + "] must not be null");
            } else if (isBlank(claim.type())) {
                errors.add("claims[" + i + "].type must not be null or blank");
            }
        }

        return errors.isEmpty() ? CallerValidationResult.ok() : CallerValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
