package com.tessera.observability;

/**
 * Immutable correlation context that flows through one request.
 * <p>
 * Every incoming HTTP request establishes a {@code CorrelationContext}. Its values are injected
 * into SLF4J MDC so they appear on every log line written while the request is handled. The
 * tenant is only known after the tenant context has been resolved, so it starts out null and is
 * filled in with {@link #withTenantId(String)}.
 *
 * @param correlationId unique ID for the request (taken from {@code X-Correlation-ID} or generated)
 * @param userId        authenticated caller, or null before the caller is known
 * @param tenantId      external tenant identifier addressed by the request, or null
 */
public record CorrelationContext(String correlationId, String userId, String tenantId) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context that carries only a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }

    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId, tenantId);
    }

    public CorrelationContext withTenantId(String tenantId) {
        return new CorrelationContext(correlationId, userId, tenantId);
    }
}
