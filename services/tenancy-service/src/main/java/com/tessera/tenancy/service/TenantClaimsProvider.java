package com.tessera.tenancy.service;

import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.Claim;
import com.tessera.security.TenantRoleClaim;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Produces the {@code tenant_role} claims an identity provider should embed for a user.
 * <p>
 * One claim per membership. The claims reflect storage at the time of the call; a token issued
 * from them keeps its roles until it expires.
 */
@Service
public class TenantClaimsProvider {

    private final UnrestrictedTenancyGateway unrestricted;

    public TenantClaimsProvider(UnrestrictedTenancyGateway unrestricted) {
        this.unrestricted = unrestricted;
    }

    public List<Claim> claimsFor(AuthenticatedCaller caller) {
        return unrestricted.membershipsOf(caller).stream()
                .map(m -> Claim.tenantRole(new TenantRoleClaim(m.tenant().identifier(), m.role())))
                .toList();
    }
}
