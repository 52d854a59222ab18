package com.clientspaces.quota;

/**
 * Describes one protected call: who makes it, what it is called, what it costs.
 *
 * @param tenantId        the calling tenant
 * @param planTier        the tenant's subscription tier
 * @param operationName   logical name for logs and metrics (e.g. "CreateClientSpace")
 * @param budgetKind      budget charged on success
 * @param amount          units charged on success, positive
 * @param createsResource resource kind the operation creates, null if none
 */
public record ProtectedOperation(
        String tenantId,
        String planTier,
        String operationName,
        BudgetKind budgetKind,
        long amount,
        ResourceKind createsResource) {

    public ProtectedOperation {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (planTier == null || planTier.isBlank()) {
            throw new IllegalArgumentException("planTier must not be null or blank");
        }
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName must not be null or blank");
        }
        if (budgetKind == null) {
            throw new IllegalArgumentException("budgetKind must not be null");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
    }

    /** An operation charging one unit and creating nothing. */
    public static ProtectedOperation of(
            String tenantId, String planTier, String operationName, BudgetKind budgetKind) {
        return new ProtectedOperation(tenantId, planTier, operationName, budgetKind, 1, null);
    }

    public ProtectedOperation withAmount(long amount) {
        return new ProtectedOperation(tenantId, planTier, operationName, budgetKind, amount, createsResource);
    }

    public ProtectedOperation creating(ResourceKind resourceKind) {
        return new ProtectedOperation(tenantId, planTier, operationName, budgetKind, amount, resourceKind);
    }
}
