package com.clientspaces.quota;

import com.clientspaces.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approves or denies an operation before it reaches the upstream API.
 * <p>
 * Checks run in a fixed order and stop at the first denial:
 * <ol>
 *   <li>static resource cap, only for resource-creating operations
 *   <li>per-tenant rate limit (takes a slot when allowed)
 *   <li>monthly usage budget (read-only)
 * </ol>
 * A slot taken by the rate limiter is not returned when the budget check then denies.
 */
public class QuotaGate {

    private static final Logger log = LoggerFactory.getLogger(QuotaGate.class);

    static final String METRIC_DENIALS = "quota.denials";

    private final PlanLimitResolver plans;
    private final ResourceCountStore resourceCounts;
    private final RateLimiter rateLimiter;
    private final UsageBudgetTracker budgets;
    private final DenialAuditSink auditSink;
    private final MetricFactory metrics;

    public QuotaGate(
            PlanLimitResolver plans,
            ResourceCountStore resourceCounts,
            RateLimiter rateLimiter,
            UsageBudgetTracker budgets,
            DenialAuditSink auditSink,
            MetricFactory metrics) {
        this.plans = plans;
        this.resourceCounts = resourceCounts;
        this.rateLimiter = rateLimiter;
        this.budgets = budgets;
        this.auditSink = auditSink;
        this.metrics = metrics;
    }

    public QuotaDecision check(String tenantId, String planTier, BudgetKind budgetKind) {
        return check(ProtectedOperation.of(tenantId, planTier, budgetKind.name(), budgetKind));
    }

    /**
     * Runs the checks for {@code operation}.
     *
     * @throws UnknownPlanTierException if the operation's tier is not configured
     */
    public QuotaDecision check(ProtectedOperation operation) {
        String tenantId = operation.tenantId();
        PlanLimits limits = plans.resolve(operation.planTier());

        ResourceKind creates = operation.createsResource();
        if (creates != null) {
            Limit cap = limits.resourceLimit(creates);
            if (!cap.isUnlimited()) {
                long current = resourceCounts.countActive(tenantId, creates);
                if (!cap.allows(current)) {
                    return deny(operation, limits, QuotaDenialReason.STATIC_LIMIT_EXCEEDED,
                            new OperationError.StaticLimitExceeded(creates, current, cap.max(),
                                    limits.tier(), upgradeTier(limits)));
                }
            }
        }

        RateDecision rate = rateLimiter.tryConsume(tenantId, limits);
        if (!rate.allowed()) {
            return deny(operation, limits, QuotaDenialReason.RATE_LIMITED,
                    new OperationError.RateLimited(rate.retryAfter()));
        }

        BudgetKind budgetKind = operation.budgetKind();
        BudgetDecision budget = budgets.tryReserve(tenantId, budgetKind, limits.budgetLimit(budgetKind));
        if (!budget.allowed()) {
            return deny(operation, limits, QuotaDenialReason.USAGE_BUDGET_EXCEEDED,
                    new OperationError.UsageBudgetExceeded(budgetKind, budget.current(),
                            budget.limit().max(), limits.tier(), upgradeTier(limits)));
        }
        return QuotaDecision.allow(limits);
    }

    private QuotaDecision deny(
            ProtectedOperation operation, PlanLimits limits, QuotaDenialReason reason, OperationError denial) {
        log.info("Denied {} for tenant {} on {} plan: {}",
                operation.operationName(), operation.tenantId(), limits.tier(), reason);
        metrics.counter(METRIC_DENIALS, "Operations denied by quota checks",
                "reason", reason.tagValue()).increment();
        try {
            auditSink.denied(new QuotaDenial(operation.tenantId(), limits.tier(),
                    operation.operationName(), reason, denial.message()));
        } catch (RuntimeException e) {
            log.warn("Denial audit failed for tenant {}", operation.tenantId(), e);
        }
        return QuotaDecision.deny(reason, denial, limits);
    }

    private String upgradeTier(PlanLimits limits) {
        return plans.upgradeTierFor(limits.tier()).orElse(null);
    }
}
