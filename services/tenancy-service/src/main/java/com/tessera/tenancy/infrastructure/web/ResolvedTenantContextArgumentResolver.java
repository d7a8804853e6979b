package com.tessera.tenancy.infrastructure.web;

import com.tessera.security.ResolvedTenantContext;
import com.tessera.tenancy.domain.exception.TenantContextNotResolvedException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Hands the request's {@link ResolvedTenantContext} to handler methods as an explicit argument.
 *
 * <p>A handler that asks for a context without declaring {@link RequireTenantRole} gets a
 * {@link TenantContextNotResolvedException} instead of an empty or default context.
 */
@Component
public class ResolvedTenantContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ResolvedTenantContext.class.equals(parameter.getParameterType());
    }

    @Override
    public ResolvedTenantContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        return TenancyRequestAttributes.tenantContext(request)
                .orElseThrow(() -> new TenantContextNotResolvedException(String.valueOf(parameter.getMethod())));
    }
}
