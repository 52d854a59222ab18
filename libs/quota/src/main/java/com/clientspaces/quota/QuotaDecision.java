package com.clientspaces.quota;

import java.time.Duration;
import java.util.Optional;

/**
 * Result of {@link QuotaGate#check}.
 *
 * @param reason {@link QuotaDenialReason#OK} when allowed
 * @param denial the typed denial, null when allowed
 * @param limits the limits the decision was made against
 */
public record QuotaDecision(QuotaDenialReason reason, OperationError denial, PlanLimits limits) {

    static QuotaDecision allow(PlanLimits limits) {
        return new QuotaDecision(QuotaDenialReason.OK, null, limits);
    }

    static QuotaDecision deny(QuotaDenialReason reason, OperationError denial, PlanLimits limits) {
        return new QuotaDecision(reason, denial, limits);
    }

    public boolean allowed() {
        return reason == QuotaDenialReason.OK;
    }

    /** Present only for {@link QuotaDenialReason#RATE_LIMITED}. */
    public Optional<Duration> retryAfter() {
        return denial instanceof OperationError.RateLimited rateLimited
                ? Optional.of(rateLimited.retryAfter())
                : Optional.empty();
    }
}
