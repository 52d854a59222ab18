package com.clientspaces.quota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-tenant fixed-window request counter.
 * <p>
 * Each tenant owns one {@link TenantWindow} guarded by its own lock, so rollover and increment
 * are atomic for that tenant while other tenants never contend. Windows are created lazily and
 * can be evicted once idle.
 * <p>
 * A denied request does not increment the counter. Callers that check further limits after an
 * allowed request do not give the slot back when those later checks fail.
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final ConcurrentHashMap<String, TenantWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimiter(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
    }

    public RateDecision tryConsume(String tenantId, PlanLimits limits) {
        return tryConsume(tenantId, limits.maxRequestsPerWindow(), limits.windowLength());
    }

    /**
     * Takes one slot from the tenant's current window if one is free.
     *
     * @param tenantId     the tenant
     * @param maxRequests  ceiling per window (may be unlimited)
     * @param windowLength length of the window
     * @return allowed, or denied with the time until the window rolls over
     */
    public RateDecision tryConsume(String tenantId, Limit maxRequests, Duration windowLength) {
        requireTenant(tenantId);
        while (true) {
            TenantWindow window = windows.computeIfAbsent(tenantId, id -> new TenantWindow());
            window.lock.lock();
            try {
                if (window.retired) {
                    continue;
                }
                Instant now = clock.instant();
                window.lastAccess = now;
                if (window.windowStart == null
                        || !now.isBefore(window.windowStart.plus(windowLength))) {
                    window.windowStart = now;
                    window.count = 0;
                }
                Instant resetAt = window.windowStart.plus(windowLength);
                window.windowEnd = resetAt;
                if (maxRequests.allows(window.count)) {
                    window.count++;
                    return RateDecision.allowed(window.count, maxRequests, resetAt);
                }
                return RateDecision.denied(window.count, maxRequests, resetAt, Duration.between(now, resetAt));
            } finally {
                window.lock.unlock();
            }
        }
    }

    public RateLimitStatus status(String tenantId, PlanLimits limits) {
        return status(tenantId, limits.maxRequestsPerWindow(), limits.windowLength());
    }

    /**
     * Reports the tenant's live window without consuming a slot. An expired window reports
     * zero requests.
     */
    public RateLimitStatus status(String tenantId, Limit maxRequests, Duration windowLength) {
        requireTenant(tenantId);
        TenantWindow window = windows.get(tenantId);
        if (window == null) {
            return new RateLimitStatus(tenantId, 0, maxRequests, null, null);
        }
        window.lock.lock();
        try {
            Instant now = clock.instant();
            if (window.retired || window.windowStart == null
                    || !now.isBefore(window.windowStart.plus(windowLength))) {
                return new RateLimitStatus(tenantId, 0, maxRequests, null, null);
            }
            return new RateLimitStatus(tenantId, window.count, maxRequests,
                    window.windowStart, window.windowStart.plus(windowLength));
        } finally {
            window.lock.unlock();
        }
    }

    /** Drops the tenant's window; the next request opens a fresh one. */
    public void reset(String tenantId) {
        requireTenant(tenantId);
        TenantWindow window = windows.get(tenantId);
        if (window != null && retire(tenantId, window, null, null)) {
            log.info("Rate limit window reset for tenant {}", tenantId);
        }
    }

    /**
     * Removes windows that have not been touched for {@code maxIdle} and have run their full
     * length. A window that is still open is kept however long it has been idle.
     *
     * @return number of windows removed
     */
    public int evictIdle(Duration maxIdle) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(maxIdle);
        int evicted = 0;
        for (var entry : windows.entrySet()) {
            if (retire(entry.getKey(), entry.getValue(), now, cutoff)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} idle rate limit windows", evicted);
        }
        return evicted;
    }

    /** Number of tenants with a tracked window. */
    public int trackedTenants() {
        return windows.size();
    }

    /**
     * Retires under the window's lock so a concurrent consume retries on a fresh window.
     * A null {@code idleCutoff} retires unconditionally.
     */
    private boolean retire(String tenantId, TenantWindow window, Instant now, Instant idleCutoff) {
        window.lock.lock();
        try {
            if (window.retired) {
                return false;
            }
            if (idleCutoff != null) {
                if (window.lastAccess != null && window.lastAccess.isAfter(idleCutoff)) {
                    return false;
                }
                if (window.windowEnd != null && now.isBefore(window.windowEnd)) {
                    return false;
                }
            }
            window.retired = true;
            windows.remove(tenantId, window);
            return true;
        } finally {
            window.lock.unlock();
        }
    }

    private static void requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
    }

    private static final class TenantWindow {
        private final ReentrantLock lock = new ReentrantLock();
        private Instant windowStart;
        private Instant windowEnd;
        private Instant lastAccess;
        private long count;
        private boolean retired;
    }
}
