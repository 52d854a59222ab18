package com.clientspaces.quota;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Pure lookup from plan tier name to {@link PlanLimits}.
 * <p>
 * Tier names and aliases match case-insensitively. The catalog is fixed at construction;
 * a tier change for a tenant is a different lookup, never an edit.
 */
public final class PlanLimitResolver {

    private final Map<String, PlanLimits> plansByKey;
    private final Map<String, String> aliasesByKey;
    private final List<String> tiersInOrder;

    /**
     * @param plans   tiers in upgrade order (cheapest first)
     * @param aliases alternative tier name → canonical tier name
     * @throws PlanConfigurationException if tiers are duplicated or an alias targets no tier
     */
    public PlanLimitResolver(List<PlanLimits> plans, Map<String, String> aliases) {
        if (plans == null || plans.isEmpty()) {
            throw new PlanConfigurationException("At least one plan tier must be configured");
        }
        Map<String, PlanLimits> byKey = new LinkedHashMap<>();
        List<String> order = new ArrayList<>();
        for (PlanLimits plan : plans) {
            if (byKey.putIfAbsent(key(plan.tier()), plan) != null) {
                throw new PlanConfigurationException("Duplicate plan tier '%s'".formatted(plan.tier()));
            }
            order.add(plan.tier());
        }
        Map<String, String> aliasKeys = new LinkedHashMap<>();
        if (aliases != null) {
            aliases.forEach((alias, target) -> {
                if (!byKey.containsKey(key(target))) {
                    throw new PlanConfigurationException(
                            "Alias '%s' points to unknown tier '%s'".formatted(alias, target));
                }
                aliasKeys.put(key(alias), key(target));
            });
        }
        this.plansByKey = Map.copyOf(byKey);
        this.aliasesByKey = Map.copyOf(aliasKeys);
        this.tiersInOrder = List.copyOf(order);
    }

    /**
     * Returns the limits of {@code tier}.
     *
     * @throws UnknownPlanTierException if the tier is not in the catalog
     */
    public PlanLimits resolve(String tier) {
        return find(tier).orElseThrow(() -> new UnknownPlanTierException(tier));
    }

    public Optional<PlanLimits> find(String tier) {
        if (tier == null || tier.isBlank()) {
            return Optional.empty();
        }
        String key = key(tier);
        return Optional.ofNullable(plansByKey.get(aliasesByKey.getOrDefault(key, key)));
    }

    /**
     * Checks that every tier referenced by live subscriptions resolves.
     *
     * @throws PlanConfigurationException listing every unresolvable tier
     */
    public void validate(Collection<String> referencedTiers) {
        TreeSet<String> missing = new TreeSet<>();
        for (String tier : referencedTiers) {
            if (find(tier).isEmpty()) {
                missing.add(String.valueOf(tier));
            }
        }
        if (!missing.isEmpty()) {
            throw new PlanConfigurationException(
                    "Subscriptions reference plan tiers without limits: " + missing);
        }
    }

    /** The next tier up from {@code tier}, if there is one. */
    public Optional<String> upgradeTierFor(String tier) {
        return find(tier).flatMap(plan -> {
            int index = tiersInOrder.indexOf(plan.tier());
            return index + 1 < tiersInOrder.size()
                    ? Optional.of(tiersInOrder.get(index + 1))
                    : Optional.empty();
        });
    }

    /** Canonical tier names in upgrade order. */
    public List<String> tiers() {
        return tiersInOrder;
    }

    private static String key(String tier) {
        return tier.trim().toLowerCase(Locale.ROOT);
    }
}
