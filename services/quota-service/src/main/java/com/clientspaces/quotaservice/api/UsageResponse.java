package com.clientspaces.quotaservice.api;

import com.clientspaces.quota.UsageSnapshot;
import java.time.Instant;

/**
 * Monthly usage of one budget. {@code limit} and {@code percentUsed} are null when the plan
 * does not cap this budget.
 */
public record UsageResponse(
        String tenantId,
        String planTier,
        String budgetKind,
        long current,
        Long limit,
        Double percentUsed,
        Instant periodStart) {

    static UsageResponse of(UsageSnapshot snapshot, String planTier) {
        return new UsageResponse(
                snapshot.tenantId(),
                planTier,
                snapshot.budgetKind().name(),
                snapshot.current(),
                snapshot.limit().isUnlimited() ? null : snapshot.limit().max(),
                snapshot.percentUsed(),
                snapshot.monthStart());
    }
}
