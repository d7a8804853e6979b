package com.tessera.tenancy.infrastructure.web;

import com.tessera.observability.CorrelationContextHolder;
import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.ResolvedTenantContext;
import com.tessera.security.TenantRolePolicies;
import com.tessera.security.TenantRolePolicy;
import com.tessera.tenancy.domain.exception.UnauthenticatedCallerException;
import com.tessera.tenancy.service.TenantContextResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Enforces authentication and tenant role requirements before a handler runs.
 *
 * <p>Every API handler needs an authenticated caller. Handlers annotated with {@link
 * RequireTenantRole} additionally get their tenant context resolved here and published on the
 * request. Failures are thrown as exceptions and rendered by {@code GlobalExceptionHandler}.
 */
@Component
public class TenantAccessInterceptor implements HandlerInterceptor {

    public static final String TENANT_IDENTIFIER_VARIABLE = "tenantIdentifier";

    private final TenantRolePolicies policies;
    private final TenantContextResolver resolver;

    public TenantAccessInterceptor(TenantRolePolicies policies, TenantContextResolver resolver) {
        this.policies = policies;
        this.resolver = resolver;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        AuthenticatedCaller caller = TenancyRequestAttributes.caller(request)
                .orElseThrow(() -> new UnauthenticatedCallerException(rejection(request)));

        RequireTenantRole requirement = findRequirement(method);
        if (requirement == null) {
            return true;
        }
        TenantRolePolicy policy = policies.forRole(requirement.value());

        String rawIdentifier = tenantIdentifierOf(request, method);
        CorrelationContextHolder.update(ctx -> ctx.withTenantId(rawIdentifier));

        ResolvedTenantContext context = resolver.resolve(caller, rawIdentifier, policy);
        TenancyRequestAttributes.publishTenantContext(request, context);
        return true;
    }

    private static RequireTenantRole findRequirement(HandlerMethod method) {
        RequireTenantRole onMethod = method.getMethodAnnotation(RequireTenantRole.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), RequireTenantRole.class);
    }

    private static String tenantIdentifierOf(HttpServletRequest request, HandlerMethod method) {
        Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        Object raw = attribute instanceof Map<?, ?> variables ? variables.get(TENANT_IDENTIFIER_VARIABLE) : null;
        if (raw == null) {
            throw new IllegalStateException("Handler " + method.getShortLogMessage()
                    + " requires a tenant role but its route has no {" + TENANT_IDENTIFIER_VARIABLE + "} variable");
        }
        return raw.toString();
    }

    private static String rejection(HttpServletRequest request) {
        Object reason = request.getAttribute(TenancyRequestAttributes.CALLER_REJECTION);
        return reason == null ? "No caller context supplied" : reason.toString();
    }
}
