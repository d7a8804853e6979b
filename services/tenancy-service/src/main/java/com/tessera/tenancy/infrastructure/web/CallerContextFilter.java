package com.tessera.tenancy.infrastructure.web;

import com.tessera.observability.CorrelationContextHolder;
import com.tessera.security.AuthenticatedCaller;
import com.tessera.security.CallerContextCodec;
import com.tessera.security.CallerContextCodec.CallerContextFormatException;
import com.tessera.security.CallerContextValidator;
import com.tessera.security.CallerValidationResult;
import com.tessera.tenancy.config.TenancyServiceProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Decodes the caller forwarded by the upstream gateway.
 *
 * <p>The gateway has already verified the caller's credentials and sends the identity and claim
 * bundle in a header (see {@link CallerContextCodec}). This filter only decodes it. It never
 * rejects a request itself: a valid caller is stored as a request attribute, and a missing or
 * invalid one leaves the attribute unset so that {@code TenantAccessInterceptor} answers 401
 * for API routes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CallerContextFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CallerContextFilter.class);

    private final String headerName;

    public CallerContextFilter(TenancyServiceProperties properties) {
        this.headerName = properties.callerContextHeader();
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String encoded = request.getHeader(headerName);
        if (encoded == null || encoded.isBlank()) {
            request.setAttribute(TenancyRequestAttributes.CALLER_REJECTION, "No caller context supplied");
        } else {
            accept(request, encoded);
        }
        filterChain.doFilter(request, response);
    }

    private void accept(HttpServletRequest request, String encoded) {
        AuthenticatedCaller caller;
        try {
            caller = CallerContextCodec.decode(encoded);
        } catch (CallerContextFormatException e) {
            log.debug("Caller context rejected: {}", e.getMessage());
            request.setAttribute(TenancyRequestAttributes.CALLER_REJECTION, "Caller context could not be decoded");
            return;
        }
        CallerValidationResult validation = CallerContextValidator.validate(caller);
        if (!validation.valid()) {
            log.debug("Caller context invalid: {}", validation.errors());
            request.setAttribute(TenancyRequestAttributes.CALLER_REJECTION, "Caller context is incomplete");
            return;
        }
        request.setAttribute(TenancyRequestAttributes.CALLER, caller);
        CorrelationContextHolder.update(ctx -> ctx.withUserId(caller.userId()));
    }
}
