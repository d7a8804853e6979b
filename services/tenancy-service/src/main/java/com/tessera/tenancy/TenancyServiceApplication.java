package com.tessera.tenancy;

import com.tessera.database.retry.RetryProperties;
import com.tessera.tenancy.config.TenancyServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Tessera tenancy service.
 *
 * <p>Every request addressed to a tenant passes through the same chain:
 *
 * <ol>
 *   <li>{@code CorrelationIdFilter} establishes the correlation ID and MDC
 *   <li>{@code CallerContextFilter} decodes the caller forwarded by the gateway
 *   <li>{@code TenantAccessInterceptor} evaluates the route's role requirement and resolves the
 *       tenant context
 *   <li>the handler works through a tenant-scoped gateway or the lifecycle service
 *   <li>{@code GlobalExceptionHandler} renders failures as RFC 7807 problem details
 * </ol>
 */
@SpringBootApplication
@EnableConfigurationProperties({TenancyServiceProperties.class, RetryProperties.class})
public class TenancyServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(TenancyServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TenancyServiceApplication.class, args);
        log.info("Tessera tenancy service started");
    }
}
