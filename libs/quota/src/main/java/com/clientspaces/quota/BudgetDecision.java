package com.clientspaces.quota;

/**
 * Outcome of {@link UsageBudgetTracker#tryReserve}.
 *
 * @param allowed whether the operation may proceed
 * @param current usage already committed this month
 * @param limit   the monthly ceiling checked against
 */
public record BudgetDecision(boolean allowed, long current, Limit limit) {}
