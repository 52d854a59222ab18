package com.clientspaces.quota;

import java.time.Instant;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Process-local ledger. Records are kept for the life of the process.
 */
public class InMemoryUsageLedgerStore implements UsageLedgerStore {

    private final Map<LedgerKey, Queue<UsageRecord>> records = new ConcurrentHashMap<>();

    @Override
    public void append(UsageRecord record) {
        records.computeIfAbsent(new LedgerKey(record.tenantId(), record.budgetKind()),
                        key -> new ConcurrentLinkedQueue<>())
                .add(record);
    }

    @Override
    public long sumSince(String tenantId, BudgetKind budgetKind, Instant since) {
        Queue<UsageRecord> entries = records.get(new LedgerKey(tenantId, budgetKind));
        if (entries == null) {
            return 0;
        }
        return entries.stream()
                .filter(r -> !r.occurredAt().isBefore(since))
                .mapToLong(UsageRecord::amount)
                .sum();
    }

    private record LedgerKey(String tenantId, BudgetKind budgetKind) {}
}
