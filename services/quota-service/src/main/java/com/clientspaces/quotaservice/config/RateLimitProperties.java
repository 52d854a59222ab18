package com.clientspaces.quotaservice.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Rate-limiter housekeeping, bound from {@code clientspaces.rate-limit.*}.
 *
 * @param maxIdle          windows untouched for this long are evicted (default 1h)
 * @param evictionInterval how often eviction runs (default 5m)
 */
@ConfigurationProperties(prefix = "clientspaces.rate-limit")
public record RateLimitProperties(Duration maxIdle, Duration evictionInterval) {

    public RateLimitProperties {
        if (maxIdle == null) {
            maxIdle = Duration.ofHours(1);
        }
        if (evictionInterval == null) {
            evictionInterval = Duration.ofMinutes(5);
        }
    }
}
