package com.clientspaces.quotaservice.api;

import com.clientspaces.quota.BudgetKind;
import com.clientspaces.quota.PlanLimitResolver;
import com.clientspaces.quota.PlanLimits;
import com.clientspaces.quota.RateLimitStatus;
import com.clientspaces.quota.RateLimiter;
import com.clientspaces.quota.UsageBudgetTracker;
import com.clientspaces.quotaservice.domain.SubscriptionDirectory;
import com.clientspaces.quotaservice.infrastructure.web.RateLimitHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only usage views for dashboards and upgrade prompts, plus the administrative rate-limit
 * reset. None of these count against the tenant's rate limit.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
public class UsageController {

    private static final Logger log = LoggerFactory.getLogger(UsageController.class);

    private final SubscriptionDirectory subscriptions;
    private final PlanLimitResolver plans;
    private final UsageBudgetTracker budgets;
    private final RateLimiter rateLimiter;

    public UsageController(
            SubscriptionDirectory subscriptions,
            PlanLimitResolver plans,
            UsageBudgetTracker budgets,
            RateLimiter rateLimiter) {
        this.subscriptions = subscriptions;
        this.plans = plans;
        this.budgets = budgets;
        this.rateLimiter = rateLimiter;
    }

    @GetMapping("/usage/{budgetKind}")
    public UsageResponse usage(@PathVariable String tenantId, @PathVariable String budgetKind) {
        PlanLimits limits = plans.resolve(subscriptions.tierFor(tenantId));
        BudgetKind kind = BudgetKind.of(budgetKind);
        return UsageResponse.of(budgets.usage(tenantId, kind, limits.budgetLimit(kind)), limits.tier());
    }

    @GetMapping("/rate-limit")
    public ResponseEntity<RateLimitResponse> rateLimit(@PathVariable String tenantId) {
        PlanLimits limits = plans.resolve(subscriptions.tierFor(tenantId));
        RateLimitStatus status = rateLimiter.status(tenantId, limits);
        return ResponseEntity.ok()
                .headers(RateLimitHeaders.of(status.limit(), status.remaining(), status.resetAt()))
                .body(RateLimitResponse.of(status, limits.tier()));
    }

    @DeleteMapping("/rate-limit")
    public ResponseEntity<Void> resetRateLimit(@PathVariable String tenantId) {
        rateLimiter.reset(tenantId);
        log.info("Rate limit window reset for tenant {}", tenantId);
        return ResponseEntity.noContent().build();
    }
}
