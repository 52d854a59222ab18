package com.clientspaces.quotaservice.infrastructure.web;

import com.clientspaces.quota.Limit;
import java.time.Instant;
import org.springframework.http.HttpHeaders;

/**
 * Conventional {@code X-RateLimit-*} response headers. Nothing is written for unlimited plans.
 */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";

    private RateLimitHeaders() {}

    /**
     * @param resetAt end of the live window, null if the tenant has none yet
     */
    public static HttpHeaders of(Limit limit, long remaining, Instant resetAt) {
        HttpHeaders headers = new HttpHeaders();
        if (limit.isUnlimited()) {
            return headers;
        }
        headers.set(LIMIT, Long.toString(limit.max()));
        headers.set(REMAINING, Long.toString(remaining));
        if (resetAt != null) {
            headers.set(RESET, Long.toString(resetAt.getEpochSecond()));
        }
        return headers;
    }
}
