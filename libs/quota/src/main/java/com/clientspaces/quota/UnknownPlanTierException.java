package com.clientspaces.quota;

/**
 * A plan tier reached request time without an entry in the plan catalog.
 * <p>
 * Startup validation should make this impossible; seeing it means a subscription was created
 * for a tier the running configuration does not know.
 */
public class UnknownPlanTierException extends RuntimeException {

    private final String tier;

    public UnknownPlanTierException(String tier) {
        super("No plan limits configured for tier '%s'".formatted(tier));
        this.tier = tier;
    }

    public String tier() {
        return tier;
    }
}
