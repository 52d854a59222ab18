package com.clientspaces.quotaservice.config;

import com.clientspaces.resilience.RetryPolicy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Upstream retry settings, bound from {@code clientspaces.retry.*}.
 *
 * @param maxRetries    retries after the initial call (default 3)
 * @param initialDelay  delay before the first retry (default 2s)
 * @param maxDelay      cap on any single delay (default 30s)
 * @param workerThreads threads running upstream attempts (default 8)
 */
@ConfigurationProperties(prefix = "clientspaces.retry")
@Validated
public record RetryProperties(
        @Min(0) @Max(10) Integer maxRetries,
        Duration initialDelay,
        Duration maxDelay,
        @Min(1) Integer workerThreads) {

    public RetryProperties {
        if (maxRetries == null) {
            maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
        }
        if (initialDelay == null) {
            initialDelay = Duration.ofSeconds(2);
        }
        if (maxDelay == null) {
            maxDelay = Duration.ofSeconds(30);
        }
        if (workerThreads == null) {
            workerThreads = 8;
        }
    }

    public RetryPolicy toPolicy() {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay);
    }
}
