package com.tessera.tenancy.infrastructure.web;

import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.ResolvedTenantContext;
import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Request attributes that carry the caller and the resolved tenant context from the filter and
 * interceptor to the argument resolvers.
 */
public final class TenancyRequestAttributes {

    public static final String CALLER = TenancyRequestAttributes.class.getName() + ".CALLER";
    public static final String CALLER_REJECTION = TenancyRequestAttributes.class.getName() + ".CALLER_REJECTION";
    public static final String TENANT_CONTEXT = TenancyRequestAttributes.class.getName() + ".TENANT_CONTEXT";

    private TenancyRequestAttributes() {
        // utility class
    }

    public static Optional<AuthenticatedCaller> caller(HttpServletRequest request) {
        return Optional.ofNullable((AuthenticatedCaller) request.getAttribute(CALLER));
    }

    public static Optional<ResolvedTenantContext> tenantContext(HttpServletRequest request) {
        return Optional.ofNullable((ResolvedTenantContext) request.getAttribute(TENANT_CONTEXT));
    }

    /**
     * Publishes the tenant context for the request. A request has exactly one.
     *
     * @throws IllegalStateException if a context was already published
     */
    public static void publishTenantContext(HttpServletRequest request, ResolvedTenantContext context) {
        if (request.getAttribute(TENANT_CONTEXT) != null) {
            throw new IllegalStateException("Tenant context already published for " + request.getRequestURI());
        }
        request.setAttribute(TENANT_CONTEXT, context);
    }
}
