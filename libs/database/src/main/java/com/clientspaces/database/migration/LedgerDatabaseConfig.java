package com.clientspaces.database.migration;

import com.clientspaces.database.ledger.JdbcUsageLedgerStore;
import com.clientspaces.quota.UsageLedgerStore;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Wires the JDBC usage ledger: its own {@link DataSource}, a Flyway instance for the ledger
 * schema, and the {@link JdbcUsageLedgerStore}.
 * <p>
 * Active only with {@code clientspaces.ledger.store=jdbc}. Services using it exclude Spring Boot's
 * {@code DataSourceAutoConfiguration} and {@code FlywayAutoConfiguration}, since the ledger is not
 * the application's primary datasource.
 *
 * @see LedgerFlywayProperties
 */
@Configuration
@EnableConfigurationProperties(LedgerFlywayProperties.class)
@ConditionalOnProperty(prefix = "clientspaces.ledger", name = "store", havingValue = "jdbc")
public class LedgerDatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerDatabaseConfig.class);

    public static final String LEDGER_DATASOURCE_BEAN = "ledgerDataSource";
    public static final String LEDGER_FLYWAY_BEAN = "ledgerFlyway";

    @Bean(name = LEDGER_DATASOURCE_BEAN)
    public DataSource ledgerDataSource(LedgerFlywayProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.url())
                .username(properties.username())
                .password(properties.password())
                .build();
    }

    /**
     * Migrates the ledger schema when {@code clientspaces.flyway.ledger.enabled=true}; otherwise the
     * schema is expected to exist already.
     */
    @Bean(name = LEDGER_FLYWAY_BEAN)
    public Flyway ledgerFlyway(
            @Qualifier(LEDGER_DATASOURCE_BEAN) DataSource dataSource, LedgerFlywayProperties properties) {
        Flyway flyway = createFlyway(dataSource, properties.locations());
        if (properties.enabled()) {
            int applied = flyway.migrate().migrationsExecuted;
            log.info("Usage ledger schema migrated ({} migrations applied)", applied);
        }
        return flyway;
    }

    @Bean
    @DependsOn(LEDGER_FLYWAY_BEAN)
    public UsageLedgerStore jdbcUsageLedgerStore(@Qualifier(LEDGER_DATASOURCE_BEAN) DataSource dataSource) {
        return new JdbcUsageLedgerStore(new JdbcTemplate(dataSource));
    }

    static Flyway createFlyway(DataSource dataSource, String locations) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
