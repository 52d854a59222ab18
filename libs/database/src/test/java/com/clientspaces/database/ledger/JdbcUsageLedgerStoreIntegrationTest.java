package com.clientspaces.database.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import com.clientspaces.database.migration.LedgerFlywayProperties;
import com.clientspaces.quota.BudgetKind;
import com.clientspaces.quota.UsageRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the ledger against a real PostgreSQL with the Flyway schema. Skipped without Docker.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("JdbcUsageLedgerStore on PostgreSQL")
class JdbcUsageLedgerStoreIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private static JdbcTemplate jdbcTemplate;

    private JdbcUsageLedgerStore store;

    @BeforeAll
    static void migrate() {
        DataSource dataSource = DataSourceBuilder.create()
                .url(POSTGRES.getJdbcUrl())
                .username(POSTGRES.getUsername())
                .password(POSTGRES.getPassword())
                .build();
        Flyway.configure()
                .dataSource(dataSource)
                .locations(LedgerFlywayProperties.DEFAULT_LOCATIONS)
                .load()
                .migrate();
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM usage_ledger");
        store = new JdbcUsageLedgerStore(jdbcTemplate);
    }

    @Test
    @DisplayName("sums only rows at or after the month start")
    void sumsCurrentMonth() {
        store.append(record("tenant-a", 5, "2025-02-28T23:59:59Z"));
        store.append(record("tenant-a", 3, "2025-03-01T00:00:00Z"));
        store.append(record("tenant-a", 4, "2025-03-15T12:00:00Z"));

        assertThat(store.sumSince("tenant-a", BudgetKind.AI_MESSAGE, Instant.parse("2025-03-01T00:00:00Z")))
                .isEqualTo(7);
    }

    @Test
    @DisplayName("keeps tenants and budget kinds apart")
    void separatesTenantsAndKinds() {
        store.append(record("tenant-a", 5, "2025-03-02T00:00:00Z"));
        store.append(new UsageRecord("tenant-a", BudgetKind.API_CALL, 9, Instant.parse("2025-03-02T00:00:00Z")));

        Instant since = Instant.parse("2025-03-01T00:00:00Z");
        assertThat(store.sumSince("tenant-b", BudgetKind.AI_MESSAGE, since)).isZero();
        assertThat(store.sumSince("tenant-a", BudgetKind.API_CALL, since)).isEqualTo(9);
    }

    @Test
    @DisplayName("counts every concurrent append")
    void concurrentAppends() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> work = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                work.add(pool.submit(() -> {
                    for (int n = 0; n < 25; n++) {
                        store.append(record("tenant-a", 1, "2025-03-05T00:00:00Z"));
                    }
                }));
            }
            for (Future<?> f : work) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.sumSince("tenant-a", BudgetKind.AI_MESSAGE, Instant.parse("2025-03-01T00:00:00Z")))
                .isEqualTo(100);
    }

    private static UsageRecord record(String tenantId, long amount, String at) {
        return new UsageRecord(tenantId, BudgetKind.AI_MESSAGE, amount, Instant.parse(at));
    }
}
