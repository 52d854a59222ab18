package com.clientspaces.quota;

import java.time.Instant;

/**
 * Read-only view of a tenant's current rate-limit window.
 *
 * @param tenantId    the tenant
 * @param count       requests counted in the live window (0 if none)
 * @param limit       the plan's ceiling
 * @param windowStart start of the live window, null if the tenant has none
 * @param resetAt     when the live window ends, null if the tenant has none
 */
public record RateLimitStatus(String tenantId, long count, Limit limit, Instant windowStart, Instant resetAt) {

    public long remaining() {
        return limit.remaining(count);
    }
}
