package com.clientspaces.quota;

/**
 * Why {@link QuotaGate} let an operation through or not.
 */
public enum QuotaDenialReason {
    OK,
    RATE_LIMITED,
    USAGE_BUDGET_EXCEEDED,
    STATIC_LIMIT_EXCEEDED;

    /** Tag value for metrics. */
    public String tagValue() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
