package com.clientspaces.quotaservice;

import com.clientspaces.database.migration.LedgerDatabaseConfig;
import com.clientspaces.quotaservice.config.LedgerProperties;
import com.clientspaces.quotaservice.config.PlansProperties;
import com.clientspaces.quotaservice.config.RateLimitProperties;
import com.clientspaces.quotaservice.config.RetryProperties;
import com.clientspaces.quotaservice.config.ServiceProperties;
import com.clientspaces.quotaservice.config.SubscriptionsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Quota service: runs tenant operations against the collaboration API behind plan caps, rate
 * limits, monthly usage budgets and classified retries.
 *
 * <p>The usage ledger database is wired by {@link LedgerDatabaseConfig}, so Spring Boot's own
 * datasource and Flyway auto-configuration are excluded.
 */
@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class, FlywayAutoConfiguration.class})
@EnableConfigurationProperties({
    ServiceProperties.class,
    RetryProperties.class,
    PlansProperties.class,
    SubscriptionsProperties.class,
    LedgerProperties.class,
    RateLimitProperties.class
})
@Import(LedgerDatabaseConfig.class)
@EnableScheduling
public class QuotaServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(QuotaServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(QuotaServiceApplication.class, args);
        log.info("Quota service started");
    }
}
