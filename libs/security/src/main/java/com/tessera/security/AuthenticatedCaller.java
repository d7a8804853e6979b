package com.tessera.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The caller of a request, as established by upstream credential verification.
 *
 * <p>WHY a record: immutable and thread-safe. This subsystem never verifies credentials itself;
 * it trusts the claim bundle it is handed and only interprets the {@code tenant_role} claims.
 *
 * @param userId unique user identifier (the 'sub' of the upstream token)
 * @param claims the verified claim bundle, in issue order
 */
public record AuthenticatedCaller(String userId, List<Claim> claims) {

    /** Longest user identifier the membership store can hold. */
    public static final int MAX_USER_ID_LENGTH = 255;

    public AuthenticatedCaller {
        claims = claims == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(claims));
    }

    /** Returns the values of every claim of the given type, in order. */
    public List<String> claimValues(String type) {
        return claims.stream().filter(c -> c != null && type.equals(c.type())).map(Claim::value).toList();
    }

    /** Shorthand for the caller's {@code tenant_role} claim values. */
    public List<String> tenantRoleClaims() {
        return claimValues(TenantRoleClaim.CLAIM_TYPE);
    }
}
