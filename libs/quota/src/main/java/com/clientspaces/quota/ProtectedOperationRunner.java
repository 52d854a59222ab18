package com.clientspaces.quota;

import com.clientspaces.observability.CorrelationContext;
import com.clientspaces.observability.CorrelationContextHolder;
import com.clientspaces.resilience.ExternalApiCall;
import com.clientspaces.resilience.RetryExecutor;
import com.clientspaces.resilience.UpstreamFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for business code calling the collaboration API on behalf of a tenant.
 * <p>
 * A call passes {@link QuotaGate} first; a denied call never reaches the upstream API. An
 * allowed call runs through {@link RetryExecutor}, and usage is committed only after it
 * succeeds. Both denials and upstream failures come back as an {@link OperationResult}; the
 * returned future only completes exceptionally for unexpected errors or cancellation.
 */
public class ProtectedOperationRunner {

    private static final Logger log = LoggerFactory.getLogger(ProtectedOperationRunner.class);

    private final QuotaGate gate;
    private final RetryExecutor retryExecutor;
    private final UsageBudgetTracker budgets;

    public ProtectedOperationRunner(QuotaGate gate, RetryExecutor retryExecutor, UsageBudgetTracker budgets) {
        if (gate == null) {
            throw new IllegalArgumentException("gate must not be null");
        }
        if (retryExecutor == null) {
            throw new IllegalArgumentException("retryExecutor must not be null");
        }
        if (budgets == null) {
            throw new IllegalArgumentException("budgets must not be null");
        }
        this.gate = gate;
        this.retryExecutor = retryExecutor;
        this.budgets = budgets;
    }

    /**
     * Runs {@code call} for the tenant, charging one unit of {@code budgetKind} on success.
     * The budget kind doubles as the operation name.
     */
    public <T> CompletableFuture<OperationResult<T>> execute(
            String tenantId, String planTier, BudgetKind budgetKind, ExternalApiCall<T> call) {
        return execute(ProtectedOperation.of(tenantId, planTier, budgetKind.name(), budgetKind), call);
    }

    /**
     * Runs {@code call} as {@code operation}.
     * <p>
     * Without a bound correlation context, a fresh correlation ID is bound for the upstream
     * attempts so their logs carry the reference reported in {@link OperationError.UpstreamFailed}.
     * Cancelling the returned future cancels pending retries.
     */
    public <T> CompletableFuture<OperationResult<T>> execute(ProtectedOperation operation, ExternalApiCall<T> call) {
        QuotaDecision decision = gate.check(operation);
        if (!decision.allowed()) {
            return CompletableFuture.completedFuture(OperationResult.failure(decision.denial()));
        }

        CorrelationContext context = CorrelationContextHolder.get()
                .orElseGet(() -> new CorrelationContext(UUID.randomUUID().toString(), operation.tenantId(), null));
        String correlationId = context.correlationId();
        AtomicReference<CompletableFuture<T>> started = new AtomicReference<>();
        CorrelationContextHolder.runWithContext(context,
                () -> started.set(retryExecutor.runWithRetry(operation.operationName(), call)));
        CompletableFuture<T> upstream = started.get();
        CompletableFuture<OperationResult<T>> result = upstream.<OperationResult<T>>handle((value, error) -> {
            if (error == null) {
                commit(operation);
                return OperationResult.success(value);
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            if (cause instanceof UpstreamFailureException failure) {
                log.warn("Operation {} for tenant {} failed upstream after {} attempts ({}); reference {}",
                        operation.operationName(), operation.tenantId(), failure.attempts(),
                        failure.errorKind(), correlationId);
                return OperationResult.failure(new OperationError.UpstreamFailed(
                        failure.errorKind(), failure.attempts(), correlationId));
            }
            throw error instanceof CompletionException completion ? completion : new CompletionException(cause);
        });
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                upstream.cancel(true);
            }
        });
        return result;
    }

    private void commit(ProtectedOperation operation) {
        try {
            budgets.commit(operation.tenantId(), operation.budgetKind(), operation.amount());
        } catch (RuntimeException e) {
            // upstream change is already applied, so the result stays a success
            log.error("Usage commit failed for tenant {} after successful {} ({} {})",
                    operation.tenantId(), operation.operationName(), operation.amount(), operation.budgetKind(), e);
        }
    }
}
