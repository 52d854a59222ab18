package com.clientspaces.resilience;

import java.time.Duration;

/**
 * State of one failed attempt inside a single {@link RetryExecutor} invocation.
 * Never persisted.
 *
 * @param operationName  logical name of the protected operation
 * @param attemptNumber  1-based number of the attempt that failed
 * @param lastErrorKind  classification of that attempt's error
 * @param nextDelay      backoff before the next attempt
 */
public record RetryAttempt(
        String operationName, int attemptNumber, ErrorKind lastErrorKind, Duration nextDelay) {}
