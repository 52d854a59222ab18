package com.clientspaces.database.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.clientspaces.quota.BudgetKind;
import com.clientspaces.quota.UsageRecord;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

@DisplayName("JdbcUsageLedgerStore")
class JdbcUsageLedgerStoreTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcUsageLedgerStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        store = new JdbcUsageLedgerStore(jdbcTemplate);
    }

    @Test
    @DisplayName("inserts one row per record with a UTC timestamp")
    void appendInsertsRow() {
        Instant at = Instant.parse("2025-03-10T09:00:00Z");

        store.append(new UsageRecord("tenant-a", BudgetKind.AI_MESSAGE, 3, at));

        verify(jdbcTemplate).update(JdbcUsageLedgerStore.INSERT_SQL,
                "tenant-a", "ai-message", 3L, OffsetDateTime.of(2025, 3, 10, 9, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("sums rows since the given instant")
    void sumSinceQueries() {
        when(jdbcTemplate.queryForObject(eq(JdbcUsageLedgerStore.SUM_SINCE_SQL), eq(Long.class),
                any(Object[].class))).thenReturn(17L);

        assertThat(store.sumSince("tenant-a", BudgetKind.AI_MESSAGE, Instant.parse("2025-03-01T00:00:00Z")))
                .isEqualTo(17);
    }

    @Test
    @DisplayName("treats a null aggregate as zero")
    void nullSumIsZero() {
        assertThat(store.sumSince("tenant-a", BudgetKind.AI_MESSAGE, Instant.EPOCH)).isZero();
    }

    @Test
    @DisplayName("requires a JdbcTemplate")
    void requiresTemplate() {
        assertThatThrownBy(() -> new JdbcUsageLedgerStore(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jdbcTemplate");
    }
}
