package com.clientspaces.quotaservice.domain;

import java.util.Map;

/**
 * Looks up the plan tier of a tenant. Tenants without a subscription are on the default tier.
 */
public class SubscriptionDirectory {

    private final Map<String, String> tiersByTenant;
    private final String defaultTier;

    public SubscriptionDirectory(Map<String, String> tiersByTenant, String defaultTier) {
        this.tiersByTenant = Map.copyOf(tiersByTenant);
        this.defaultTier = defaultTier;
    }

    public String tierFor(String tenantId) {
        return tiersByTenant.getOrDefault(tenantId, defaultTier);
    }
}
