package com.tessera.tenancy.service;

import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.PolicyDecision;
import com.tessera.security.ResolvedTenantContext;
import com.tessera.security.TenantIdentifiers;
import com.tessera.security.TenantPolicyEvaluator;
import com.tessera.security.TenantRole;
import com.tessera.security.TenantRoleClaim;
import com.tessera.security.TenantRolePolicy;
import com.tessera.tenancy.domain.Tenant;
import com.tessera.tenancy.domain.exception.InsufficientTenantRoleException;
import com.tessera.tenancy.domain.exception.MalformedTenantIdentifierException;
import com.tessera.tenancy.domain.exception.TenantAccessDeniedException;
import com.tessera.tenancy.domain.exception.TenantAccessDeniedException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Turns a raw tenant identifier plus the caller's claims into a {@link ResolvedTenantContext}.
 * <p>
 * Order matters: the identifier is parsed first, then the role policy is evaluated from claims
 * alone, and only an allowed caller triggers the one storage lookup. A tenant that is missing
 * by then is reported exactly like a tenant the caller has no claim for.
 */
@Service
public class TenantContextResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantContextResolver.class);

    private final UnrestrictedTenancyGateway tenants;

    public TenantContextResolver(UnrestrictedTenancyGateway tenants) {
        this.tenants = tenants;
    }

    /**
     * Resolves the tenant context for one request.
     *
     * @param caller the authenticated caller
     * @param rawTenantIdentifier the identifier exactly as it appeared in the route
     * @param policy the role policy the route requires
     * @throws MalformedTenantIdentifierException if the identifier does not parse
     * @throws TenantAccessDeniedException if the caller has no access or the tenant is gone
     * @throws InsufficientTenantRoleException if the caller's role is below the policy minimum
     */
    public ResolvedTenantContext resolve(AuthenticatedCaller caller, String rawTenantIdentifier, TenantRolePolicy policy) {
        UUID identifier = TenantIdentifiers.parse(rawTenantIdentifier)
                .orElseThrow(() -> new MalformedTenantIdentifierException(rawTenantIdentifier));

        PolicyDecision decision =
                TenantPolicyEvaluator.evaluate(policy.minimumRole(), identifier, caller.tenantRoleClaims());
        switch (decision.outcome()) {
            case DENY_NO_MEMBERSHIP -> throw new TenantAccessDeniedException(Reason.NO_MEMBERSHIP);
            case DENY_INSUFFICIENT_ROLE ->
                    throw new InsufficientTenantRoleException(policy.minimumRole(), decision.grantedRole().orElseThrow());
            case ALLOW -> log.debug("Policy {} allowed for tenant {}", policy.name(), identifier);
        }

        Tenant tenant = tenants.findTenant(identifier)
                .orElseThrow(() -> new TenantAccessDeniedException(Reason.TENANT_NOT_FOUND));

        // The role is read again from the caller's own claim; nothing else may supply it.
        TenantRole role = TenantPolicyEvaluator.findClaim(identifier, caller.tenantRoleClaims())
                .map(TenantRoleClaim::role)
                .orElseThrow(() -> new TenantAccessDeniedException(Reason.NO_MEMBERSHIP));

        return new ResolvedTenantContext(tenant.key(), role);
    }
}
