package com.clientspaces.database.ledger;

import com.clientspaces.quota.BudgetKind;
import com.clientspaces.quota.UsageLedgerStore;
import com.clientspaces.quota.UsageRecord;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * {@link UsageLedgerStore} on the {@code usage_ledger} table.
 * <p>
 * Rows are only ever inserted. Monthly totals are a {@code SUM} over the
 * {@code (tenant_id, budget_kind, occurred_at)} index.
 */
public class JdbcUsageLedgerStore implements UsageLedgerStore {

    static final String INSERT_SQL = """
            INSERT INTO usage_ledger (tenant_id, budget_kind, amount, occurred_at)
            VALUES (?, ?, ?, ?)""";

    static final String SUM_SINCE_SQL = """
            SELECT COALESCE(SUM(amount), 0)
            FROM usage_ledger
            WHERE tenant_id = ? AND budget_kind = ? AND occurred_at >= ?""";

    private final JdbcTemplate jdbcTemplate;

    public JdbcUsageLedgerStore(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void append(UsageRecord record) {
        jdbcTemplate.update(INSERT_SQL,
                record.tenantId(),
                record.budgetKind().name(),
                record.amount(),
                record.occurredAt().atOffset(ZoneOffset.UTC));
    }

    @Override
    public long sumSince(String tenantId, BudgetKind budgetKind, Instant since) {
        Long sum = jdbcTemplate.queryForObject(SUM_SINCE_SQL, Long.class,
                tenantId, budgetKind.name(), since.atOffset(ZoneOffset.UTC));
        return sum == null ? 0 : sum;
    }
}
