package com.clientspaces.quotaservice.api;

import com.clientspaces.quota.RateLimitStatus;
import java.time.Instant;

public record RateLimitResponse(
        String tenantId, String planTier, long count, Long limit, Long remaining, Instant windowStart, Instant resetAt) {

    static RateLimitResponse of(RateLimitStatus status, String planTier) {
        boolean unlimited = status.limit().isUnlimited();
        return new RateLimitResponse(
                status.tenantId(),
                planTier,
                status.count(),
                unlimited ? null : status.limit().max(),
                unlimited ? null : status.remaining(),
                status.windowStart(),
                status.resetAt());
    }
}
