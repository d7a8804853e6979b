package com.tessera.tenancy.infrastructure.web;

import com.tessera.security.AuthenticatedCaller;
import com.tessera.tenancy.domain.exception.UnauthenticatedCallerException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies the {@link AuthenticatedCaller} to handler methods that declare it.
 */
@Component
public class AuthenticatedCallerArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthenticatedCaller.class.equals(parameter.getParameterType());
    }

    @Override
    public AuthenticatedCaller resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        return TenancyRequestAttributes.caller(request)
                .orElseThrow(() -> new UnauthenticatedCallerException("No caller context supplied"));
    }
}
