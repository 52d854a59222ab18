package com.clientspaces.quotaservice.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tenant subscriptions, bound from {@code clientspaces.subscriptions.*}.
 *
 * @param defaultTier tier of tenants without an explicit subscription (default Starter)
 * @param tenants     tenant id to plan tier
 */
@ConfigurationProperties(prefix = "clientspaces.subscriptions")
public record SubscriptionsProperties(String defaultTier, Map<String, String> tenants) {

    public SubscriptionsProperties {
        if (defaultTier == null || defaultTier.isBlank()) {
            defaultTier = "Starter";
        }
        tenants = tenants == null ? Map.of() : Map.copyOf(tenants);
    }
}
