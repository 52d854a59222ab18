package com.clientspaces.quota;

import com.clientspaces.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;

/**
 * Monthly usage budgets derived from the usage ledger.
 * <p>
 * There is no running counter: usage for the month is always the ledger sum since the first
 * instant of the current UTC month, so the month boundary resets budgets without any reset job
 * and older records stay available for audit.
 * <p>
 * {@link #tryReserve} only checks; {@link #commit} records usage and is called once the
 * protected operation has succeeded.
 */
public class UsageBudgetTracker {

    private static final Logger log = LoggerFactory.getLogger(UsageBudgetTracker.class);

    static final String METRIC_COMMITS = "usage.commits";

    private final UsageLedgerStore ledger;
    private final Clock clock;
    private final MetricFactory metrics;

    public UsageBudgetTracker(UsageLedgerStore ledger, Clock clock, MetricFactory metrics) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.ledger = ledger;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Checks whether the tenant has budget left this month. Nothing is recorded.
     */
    public BudgetDecision tryReserve(String tenantId, BudgetKind budgetKind, Limit limit) {
        long current = ledger.sumSince(tenantId, budgetKind, monthStart());
        return new BudgetDecision(limit.allows(current), current, limit);
    }

    /**
     * Appends a usage record for a successful operation.
     *
     * @param amount units consumed, must be positive
     */
    public void commit(String tenantId, BudgetKind budgetKind, long amount) {
        ledger.append(new UsageRecord(tenantId, budgetKind, amount, clock.instant()));
        metrics.counter(METRIC_COMMITS, "Usage units committed to the ledger",
                "budget_kind", budgetKind.name()).increment(amount);
        log.debug("Committed {} {} for tenant {}", amount, budgetKind, tenantId);
    }

    public UsageSnapshot usage(String tenantId, BudgetKind budgetKind, Limit limit) {
        Instant monthStart = monthStart();
        return UsageSnapshot.of(tenantId, budgetKind,
                ledger.sumSince(tenantId, budgetKind, monthStart), limit, monthStart);
    }

    /** First instant of the current calendar month in UTC. */
    public Instant monthStart() {
        return YearMonth.now(clock.withZone(ZoneOffset.UTC))
                .atDay(1)
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
    }
}
