package com.tessera.tenancy.config;

import com.tessera.tenancy.infrastructure.web.AuthenticatedCallerArgumentResolver;
import com.tessera.tenancy.infrastructure.web.ResolvedTenantContextArgumentResolver;
import com.tessera.tenancy.infrastructure.web.TenantAccessInterceptor;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS, the tenant access interceptor and the argument resolvers that
 * hand the caller and the tenant context to handlers.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final TenancyServiceProperties properties;
    private final TenantAccessInterceptor tenantAccessInterceptor;
    private final AuthenticatedCallerArgumentResolver callerArgumentResolver;
    private final ResolvedTenantContextArgumentResolver tenantContextArgumentResolver;

    public WebConfig(
            TenancyServiceProperties properties,
            TenantAccessInterceptor tenantAccessInterceptor,
            AuthenticatedCallerArgumentResolver callerArgumentResolver,
            ResolvedTenantContextArgumentResolver tenantContextArgumentResolver) {
        this.properties = properties;
        this.tenantAccessInterceptor = tenantAccessInterceptor;
        this.callerArgumentResolver = callerArgumentResolver;
        this.tenantContextArgumentResolver = tenantContextArgumentResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.corsAllowedOrigins())
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(tenantAccessInterceptor).addPathPatterns("/api/**");
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(callerArgumentResolver);
        resolvers.add(tenantContextArgumentResolver);
    }
}
