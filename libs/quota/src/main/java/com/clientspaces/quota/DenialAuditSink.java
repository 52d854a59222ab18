package com.clientspaces.quota;

/**
 * Receives one event per quota denial, for operational visibility.
 * <p>
 * Implementations must not throw: an audit failure never changes the decision.
 */
@FunctionalInterface
public interface DenialAuditSink {

    void denied(QuotaDenial denial);

    static DenialAuditSink noop() {
        return denial -> { };
    }
}
