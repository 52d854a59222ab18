package com.clientspaces.quota;

import java.time.Instant;

/**
 * Usage of one budget for the current month, for dashboards and upgrade prompts.
 *
 * @param tenantId    the tenant
 * @param budgetKind  the budget
 * @param current     units committed since {@code monthStart}
 * @param limit       the plan's monthly ceiling
 * @param monthStart  first instant of the current UTC month
 * @param percentUsed share of the limit used (0-100, may exceed 100), null when unlimited
 */
public record UsageSnapshot(
        String tenantId,
        BudgetKind budgetKind,
        long current,
        Limit limit,
        Instant monthStart,
        Double percentUsed) {

    static UsageSnapshot of(String tenantId, BudgetKind kind, long current, Limit limit, Instant monthStart) {
        Double percent = null;
        if (!limit.isUnlimited()) {
            percent = limit.max() == 0 ? 100.0 : current * 100.0 / limit.max();
        }
        return new UsageSnapshot(tenantId, kind, current, limit, monthStart, percent);
    }
}
