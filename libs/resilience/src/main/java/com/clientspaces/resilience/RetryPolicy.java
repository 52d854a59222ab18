package com.clientspaces.resilience;

import java.time.Duration;

/**
 * Exponential backoff policy for transient upstream failures.
 * <p>
 * The delay before retry {@code n} (1-based) is {@code initialDelay * 2^(n-1)}, capped at
 * {@code maxDelay}. With the defaults that is 2s, 4s, 8s for retries 1 to 3, i.e. at most four
 * calls in total.
 *
 * @param maxRetries   retries after the initial call (0 disables retrying)
 * @param initialDelay delay before the first retry
 * @param maxDelay     upper bound for any single delay
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay) {

    /** Default number of retries after the initial call. */
    public static final int DEFAULT_MAX_RETRIES = 3;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("initialDelay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
    }

    /** 3 retries, 2s initial delay, 30s cap. */
    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, Duration.ofSeconds(2), Duration.ofSeconds(30));
    }

    /**
     * Returns the backoff delay to wait after failed attempt {@code attemptNumber}.
     *
     * @param attemptNumber 1-based number of the attempt that just failed
     */
    public Duration delayFor(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        int exponent = attemptNumber - 1;
        if (exponent >= 31) {
            return maxDelay;
        }
        Duration delay = initialDelay.multipliedBy(1L << exponent);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    /** Total number of calls this policy allows (initial + retries). */
    public int maxAttempts() {
        return maxRetries + 1;
    }
}
