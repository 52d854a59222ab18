package com.clientspaces.resilience;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Supplies executors that start work after a backoff delay without parking a thread.
 */
@FunctionalInterface
public interface BackoffScheduler {

    /**
     * Returns an executor that runs submitted tasks once {@code delay} has elapsed. Tasks must
     * be short: they only hand the next attempt to the worker pool.
     *
     * @param delay how long to wait before running
     */
    Executor after(Duration delay);

    /**
     * Timer-based scheduler: the task runs on the JDK's delay thread when due.
     */
    static BackoffScheduler timer() {
        return delay -> CompletableFuture.delayedExecutor(
                delay.toMillis(), TimeUnit.MILLISECONDS, Runnable::run);
    }
}
