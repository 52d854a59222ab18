package com.clientspaces.quota;

import java.time.Instant;

/**
 * One committed unit of usage in the append-only ledger.
 *
 * @param tenantId   the tenant charged
 * @param budgetKind the budget the usage counts toward
 * @param amount     units consumed, always positive
 * @param occurredAt when the protected operation succeeded
 */
public record UsageRecord(String tenantId, BudgetKind budgetKind, long amount, Instant occurredAt) {

    public UsageRecord {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (budgetKind == null) {
            throw new IllegalArgumentException("budgetKind must not be null");
        }
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive, got " + amount);
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt must not be null");
        }
    }
}
