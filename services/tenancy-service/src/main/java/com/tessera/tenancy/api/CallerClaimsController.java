package com.tessera.tenancy.api;

import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.Claim;
import com.tessera.tenancy.service.TenantClaimsProvider;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lets the identity provider fetch the {@code tenant_role} claims to embed in a caller's next
 * token.
 */
@RestController
public class CallerClaimsController {

    private final TenantClaimsProvider claims;

    public CallerClaimsController(TenantClaimsProvider claims) {
        this.claims = claims;
    }

    @GetMapping("/api/caller/tenant-claims")
    public List<Claim> tenantClaims(AuthenticatedCaller caller) {
        return claims.claimsFor(caller);
    }
}
