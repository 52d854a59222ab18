package com.clientspaces.quota;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of {@link RateLimiter#tryConsume}.
 *
 * @param allowed    whether the request took a slot
 * @param count      requests counted in the current window after this call
 * @param limit      the ceiling the request was checked against
 * @param resetAt    end of the current window
 * @param retryAfter time until the window rolls over; zero when allowed
 */
public record RateDecision(boolean allowed, long count, Limit limit, Instant resetAt, Duration retryAfter) {

    static RateDecision allowed(long count, Limit limit, Instant resetAt) {
        return new RateDecision(true, count, limit, resetAt, Duration.ZERO);
    }

    static RateDecision denied(long count, Limit limit, Instant resetAt, Duration retryAfter) {
        return new RateDecision(false, count, limit, resetAt, retryAfter);
    }

    public long remaining() {
        return limit.remaining(count);
    }
}
