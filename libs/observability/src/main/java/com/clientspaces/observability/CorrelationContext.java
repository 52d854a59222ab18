package com.clientspaces.observability;

/**
 * Immutable correlation context that flows with a tenant request through the quota layer.
 * <p>
 * Every incoming request establishes a {@code CorrelationContext}. The identifiers are injected
 * into SLF4J MDC so retry and denial logs can be traced back to the request, and the correlation
 * id is handed to end users on upstream failures for support diagnosis.
 *
 * @param correlationId unique ID for the request flow
 * @param tenantId      tenant identifier (nullable until the tenant is resolved)
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(String correlationId, String tenantId, String requestId) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Rejects a null or blank correlationId.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns a copy of this context bound to the given tenant.
     */
    public CorrelationContext withTenant(String tenantId) {
        return new CorrelationContext(correlationId, tenantId, requestId);
    }
}
