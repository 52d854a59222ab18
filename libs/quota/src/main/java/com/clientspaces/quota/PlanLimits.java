package com.clientspaces.quota;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable limits of one subscription tier.
 * <p>
 * Budget and resource kinds that the plan does not mention are unlimited.
 *
 * @param tier                 canonical tier name (e.g. "Starter")
 * @param maxRequestsPerWindow request ceiling for one rate-limit window
 * @param windowLength         length of the fixed rate-limit window
 * @param monthlyBudgets       per budget kind, the maximum usage per calendar month (UTC)
 * @param resourceLimits       per resource kind, the maximum number of live resources
 */
public record PlanLimits(
        String tier,
        Limit maxRequestsPerWindow,
        Duration windowLength,
        Map<BudgetKind, Limit> monthlyBudgets,
        Map<ResourceKind, Limit> resourceLimits) {

    public PlanLimits {
        if (tier == null || tier.isBlank()) {
            throw new IllegalArgumentException("tier must not be null or blank");
        }
        if (maxRequestsPerWindow == null) {
            throw new IllegalArgumentException("maxRequestsPerWindow must not be null");
        }
        if (windowLength == null || windowLength.isZero() || windowLength.isNegative()) {
            throw new IllegalArgumentException("windowLength must be positive");
        }
        monthlyBudgets = monthlyBudgets == null ? Map.of() : Map.copyOf(monthlyBudgets);
        resourceLimits = resourceLimits == null ? Map.of() : Map.copyOf(resourceLimits);
    }

    public Limit budgetLimit(BudgetKind kind) {
        return monthlyBudgets.getOrDefault(kind, Limit.UNLIMITED);
    }

    public Limit resourceLimit(ResourceKind kind) {
        return resourceLimits.getOrDefault(kind, Limit.UNLIMITED);
    }
}
