package com.clientspaces.quotaservice.config;

import com.clientspaces.quota.BudgetKind;
import com.clientspaces.quota.Limit;
import com.clientspaces.quota.PlanCatalog;
import com.clientspaces.quota.PlanLimitResolver;
import com.clientspaces.quota.PlanLimits;
import com.clientspaces.quota.ResourceKind;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Plan catalog, bound from {@code clientspaces.plans.*}. Tiers are listed cheapest first; that
 * order defines upgrade suggestions. A missing number means unlimited.
 *
 * <pre>
 * clientspaces:
 *   plans:
 *     tiers:
 *       Starter:
 *         requests-per-window: 300
 *         window-length: 1m
 *         monthly-budgets:
 *           ai-message: 20
 *         resource-limits:
 *           client-space: 5
 *       Enterprise:
 *         requests-per-window: 5000
 *     aliases:
 *       Free: Starter
 * </pre>
 *
 * <p>With no tiers configured the built-in {@link PlanCatalog} applies.
 *
 * @param tiers   tier name to limits, in upgrade order
 * @param aliases alternative tier names
 */
@ConfigurationProperties(prefix = "clientspaces.plans")
public record PlansProperties(Map<String, TierProperties> tiers, Map<String, String> aliases) {

    /**
     * @param requestsPerWindow ceiling per rate-limit window, null for unlimited
     * @param windowLength      window length, default one minute
     * @param monthlyBudgets    budget kind to monthly ceiling
     * @param resourceLimits    resource kind to maximum live count
     */
    public record TierProperties(
            Long requestsPerWindow,
            Duration windowLength,
            Map<String, Long> monthlyBudgets,
            Map<String, Long> resourceLimits) {

        PlanLimits toPlanLimits(String tier) {
            Map<BudgetKind, Limit> budgets = new HashMap<>();
            if (monthlyBudgets != null) {
                monthlyBudgets.forEach((kind, max) -> budgets.put(BudgetKind.of(kind), Limit.ofNullable(max)));
            }
            Map<ResourceKind, Limit> resources = new HashMap<>();
            if (resourceLimits != null) {
                resourceLimits.forEach((kind, max) -> resources.put(ResourceKind.of(kind), Limit.ofNullable(max)));
            }
            return new PlanLimits(
                    tier,
                    Limit.ofNullable(requestsPerWindow),
                    windowLength == null ? Duration.ofMinutes(1) : windowLength,
                    budgets,
                    resources);
        }
    }

    public PlansProperties {
        tiers = tiers == null ? Map.of() : new LinkedHashMap<>(tiers);
        aliases = aliases == null ? Map.of() : Map.copyOf(aliases);
    }

    /** Builds the resolver, falling back to the built-in catalog when no tiers are configured. */
    public PlanLimitResolver toResolver() {
        if (tiers.isEmpty()) {
            Map<String, String> merged = new HashMap<>(PlanCatalog.LEGACY_ALIASES);
            merged.putAll(aliases);
            return new PlanLimitResolver(PlanCatalog.builtInPlans(), merged);
        }
        List<PlanLimits> plans = new ArrayList<>();
        tiers.forEach((tier, props) -> plans.add(
                (props == null ? new TierProperties(null, null, null, null) : props).toPlanLimits(tier)));
        return new PlanLimitResolver(plans, aliases);
    }
}
