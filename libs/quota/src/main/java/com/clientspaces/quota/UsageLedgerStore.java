package com.clientspaces.quota;

import java.time.Instant;

/**
 * Durable, append-only store of {@link UsageRecord}s.
 * <p>
 * Implementations must accept concurrent appends from any number of tenants, and a sum must
 * reflect every append that completed before the sum started.
 */
public interface UsageLedgerStore {

    void append(UsageRecord record);

    /**
     * Total amount recorded for the tenant and budget kind at or after {@code since}.
     */
    long sumSince(String tenantId, BudgetKind budgetKind, Instant since);
}
