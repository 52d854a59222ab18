package com.clientspaces.quota;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Built-in subscription tiers, used when no plans are configured.
 * <p>
 * Tiers are listed in upgrade order. Rate ceilings are per minute.
 */
public final class PlanCatalog {

    public static final String STARTER = "Starter";
    public static final String PROFESSIONAL = "Professional";
    public static final String BUSINESS = "Business";
    public static final String ENTERPRISE = "Enterprise";

    /** Legacy tier names still found on older subscriptions. */
    public static final Map<String, String> LEGACY_ALIASES = Map.of(
            "Free", STARTER,
            "Pro", PROFESSIONAL);

    private static final Duration ONE_MINUTE = Duration.ofMinutes(1);

    private PlanCatalog() {
        // utility class
    }

    public static List<PlanLimits> builtInPlans() {
        return List.of(
                plan(STARTER, Limit.of(300), Limit.of(10_000), Limit.of(20),
                        Limit.of(5), Limit.of(50), Limit.of(25), Limit.of(2)),
                plan(PROFESSIONAL, Limit.of(1_000), Limit.of(50_000), Limit.of(1_000),
                        Limit.of(20), Limit.of(250), Limit.of(100), Limit.of(5)),
                plan(BUSINESS, Limit.of(2_000), Limit.of(250_000), Limit.of(5_000),
                        Limit.of(100), Limit.of(1_000), Limit.of(500), Limit.of(15)),
                plan(ENTERPRISE, Limit.of(5_000), Limit.UNLIMITED, Limit.UNLIMITED,
                        Limit.UNLIMITED, Limit.UNLIMITED, Limit.UNLIMITED, Limit.of(999)));
    }

    /** Resolver over the built-in plans and legacy aliases. */
    public static PlanLimitResolver builtIn() {
        return new PlanLimitResolver(builtInPlans(), LEGACY_ALIASES);
    }

    private static PlanLimits plan(
            String tier,
            Limit requestsPerMinute,
            Limit apiCalls,
            Limit aiMessages,
            Limit clientSpaces,
            Limit externalUsers,
            Limit libraries,
            Limit admins) {
        return new PlanLimits(
                tier,
                requestsPerMinute,
                ONE_MINUTE,
                Map.of(BudgetKind.API_CALL, apiCalls, BudgetKind.AI_MESSAGE, aiMessages),
                Map.of(
                        ResourceKind.CLIENT_SPACE, clientSpaces,
                        ResourceKind.EXTERNAL_USER, externalUsers,
                        ResourceKind.LIBRARY, libraries,
                        ResourceKind.ADMIN, admins));
    }
}
