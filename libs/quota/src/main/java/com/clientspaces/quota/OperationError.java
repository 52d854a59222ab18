package com.clientspaces.quota;

import com.clientspaces.resilience.ErrorKind;

import java.time.Duration;

/**
 * Typed failure of a protected operation.
 * <p>
 * Denials ({@link RateLimited}, {@link UsageBudgetExceeded}, {@link StaticLimitExceeded}) are
 * expected, policy-driven outcomes. {@link UpstreamFailed} means the upstream call itself failed.
 * Every variant renders a message that is safe to show to end users.
 */
public sealed interface OperationError {

    /** Stable machine-readable code. */
    String code();

    /** User-facing message. */
    String message();

    /**
     * Rejected by the per-tenant rate limiter.
     *
     * @param retryAfter time until the tenant's window rolls over
     */
    record RateLimited(Duration retryAfter) implements OperationError {

        @Override
        public String code() {
            return "RATE_LIMITED";
        }

        @Override
        public String message() {
            return "Too many requests. Please retry after %d seconds.".formatted(retryAfterSeconds());
        }

        /** Retry-after rounded up to whole seconds, at least one. */
        public long retryAfterSeconds() {
            long seconds = retryAfter.toSeconds() + (retryAfter.toNanosPart() > 0 ? 1 : 0);
            return Math.max(1, seconds);
        }
    }

    /**
     * The monthly budget for this kind of usage is spent.
     *
     * @param upgradeTier next tier up, null if already on the top tier
     */
    record UsageBudgetExceeded(
            BudgetKind budgetKind, long current, long limit, String planTier, String upgradeTier)
            implements OperationError {

        @Override
        public String code() {
            return "USAGE_BUDGET_EXCEEDED";
        }

        @Override
        public String message() {
            return "Monthly limit of %d %s exceeded for %s plan. %s"
                    .formatted(limit, budgetKind.displayUnit(), planTier, upgradeHint(upgradeTier, "continue"));
        }
    }

    /**
     * Creating another resource would exceed the plan's cap.
     *
     * @param upgradeTier next tier up, null if already on the top tier
     */
    record StaticLimitExceeded(
            ResourceKind resourceKind, long current, long limit, String planTier, String upgradeTier)
            implements OperationError {

        @Override
        public String code() {
            return "STATIC_LIMIT_EXCEEDED";
        }

        @Override
        public String message() {
            return "%s limit of %d reached for %s plan. %s"
                    .formatted(resourceKind.displayName(), limit, planTier, upgradeHint(upgradeTier, "add more"));
        }
    }

    /**
     * The upstream call failed after retries, or permanently.
     *
     * @param correlationId reference handed to support, never an upstream error code
     */
    record UpstreamFailed(ErrorKind lastErrorKind, int attempts, String correlationId) implements OperationError {

        @Override
        public String code() {
            return "UPSTREAM_FAILED";
        }

        @Override
        public String message() {
            return "The operation could not be completed. Please try again later. Reference: " + correlationId;
        }
    }

    private static String upgradeHint(String upgradeTier, String action) {
        return upgradeTier == null
                ? "Contact support to raise your limits."
                : "Upgrade to %s to %s.".formatted(upgradeTier, action);
    }
}
