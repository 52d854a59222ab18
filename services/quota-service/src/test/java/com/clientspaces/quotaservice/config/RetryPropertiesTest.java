package com.clientspaces.quotaservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.clientspaces.resilience.RetryPolicy;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Service configuration records")
class RetryPropertiesTest {

    @Test
    @DisplayName("retry settings default to three retries starting at two seconds")
    void retryDefaults() {
        var props = new RetryProperties(null, null, null, null);

        assertThat(props.workerThreads()).isEqualTo(8);
        RetryPolicy policy = props.toPolicy();
        assertThat(policy.maxRetries()).isEqualTo(3);
        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    @DisplayName("defaults environment to 'development' when null")
    void serviceEnvironmentDefault() {
        assertThat(new ServiceProperties("quota-service", null, null).environment()).isEqualTo("development");
    }

    @Test
    @DisplayName("subscriptions default to the Starter tier")
    void subscriptionDefaults() {
        var props = new SubscriptionsProperties(" ", null);

        assertThat(props.defaultTier()).isEqualTo("Starter");
        assertThat(props.tenants()).isEmpty();
    }

    @Test
    @DisplayName("ledger defaults to memory and rate-limit housekeeping to 1h idle every 5m")
    void ledgerAndRateLimitDefaults() {
        assertThat(new LedgerProperties(null).store()).isEqualTo(LedgerProperties.Store.MEMORY);
        var rateLimit = new RateLimitProperties(null, null);
        assertThat(rateLimit.maxIdle()).isEqualTo(Duration.ofHours(1));
        assertThat(rateLimit.evictionInterval()).isEqualTo(Duration.ofMinutes(5));
    }
}
