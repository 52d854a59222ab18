package com.clientspaces.quotaservice.infrastructure.ratelimit;

import com.clientspaces.quota.RateLimiter;
import com.clientspaces.quotaservice.config.RateLimitProperties;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops rate-limit windows of tenants that went quiet.
 */
@Component
public class RateLimitMaintenance {

    private final RateLimiter rateLimiter;
    private final RateLimitProperties properties;

    public RateLimitMaintenance(RateLimiter rateLimiter, RateLimitProperties properties) {
        this.rateLimiter = rateLimiter;
        this.properties = properties;
    }

    @Scheduled(
            fixedDelayString = "${clientspaces.rate-limit.eviction-interval:PT5M}",
            initialDelayString = "${clientspaces.rate-limit.eviction-interval:PT5M}")
    public int evictIdleWindows() {
        return rateLimiter.evictIdle(properties.maxIdle());
    }
}
