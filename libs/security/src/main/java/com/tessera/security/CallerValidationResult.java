package com.tessera.security;

import java.util.List;

/**
 * Result of validating an {@link AuthenticatedCaller}.
 *
 * @param valid whether the caller passed all checks
 * @param errors validation error messages (empty if valid)
 */
public record CallerValidationResult(boolean valid, List<String> errors) {

    public static CallerValidationResult ok() {
        return new CallerValidationResult(true, List.of());
    }

    public static CallerValidationResult fail(List<String> errors) {
        return new CallerValidationResult(false, List.copyOf(errors));
    }
}
