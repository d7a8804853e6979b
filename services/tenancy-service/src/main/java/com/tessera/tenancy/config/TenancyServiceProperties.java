package com.tessera.tenancy.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Type-safe configuration for the tenancy service, bound from {@code tessera.service.*}.
 *
 * <pre>
 * tessera:
 *   service:
 *     name: tenancy-service
 *     environment: production
 *     description: Tenant access control
 *     caller-context-header: X-Caller-Context
 *     transaction-timeout: 5s
 *     cors-allowed-origins: http://localhost:5173
 * </pre>
 *
 * @param name service name used for metrics tags and logs. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description for /actuator/info
 * @param callerContextHeader header carrying the caller forwarded by the gateway
 * @param transactionTimeout upper bound for one membership or tenant transaction
 * @param corsAllowedOrigins origins allowed to call {@code /api/**} from a browser
 */
@ConfigurationProperties(prefix = "tessera.service")
@Validated
public record TenancyServiceProperties(
        @NotBlank String name,
        String environment,
        String description,
        String callerContextHeader,
        Duration transactionTimeout,
        String[] corsAllowedOrigins) {

    public static final String DEFAULT_CALLER_CONTEXT_HEADER = "X-Caller-Context";

    /**
     * Applies defaults for optional fields. Runs before Bean Validation, so defaults satisfy
     * constraints.
     */
    public TenancyServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (callerContextHeader == null || callerContextHeader.isBlank()) {
            callerContextHeader = DEFAULT_CALLER_CONTEXT_HEADER;
        }
        if (transactionTimeout == null || transactionTimeout.isNegative() || transactionTimeout.isZero()) {
            transactionTimeout = Duration.ofSeconds(5);
        }
        if (corsAllowedOrigins == null) {
            corsAllowedOrigins = new String[] {"http://localhost:3000", "http://localhost:5173"};
        }
    }
}
