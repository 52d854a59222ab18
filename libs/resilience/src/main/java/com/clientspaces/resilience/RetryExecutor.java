package com.clientspaces.resilience;

import com.clientspaces.observability.CorrelationContext;
import com.clientspaces.observability.CorrelationContextHolder;
import com.clientspaces.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs upstream calls with classification-driven retries.
 * <p>
 * Transient failures are retried up to {@link RetryPolicy#maxRetries()} times with exponential
 * backoff; permanent and unknown failures fail immediately. The backoff never blocks a thread:
 * the next attempt is scheduled through the {@link BackoffScheduler} and the caller receives a
 * {@link CompletableFuture} straight away.
 * <p>
 * Cancelling the returned future stops any pending retry. The correlation context of the
 * submitting thread is re-installed on every attempt so retry logs carry the request's ids.
 * <p>
 * Terminal failures complete the future with an {@link UpstreamFailureException} holding the
 * last error, its classification and the number of calls made.
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    static final String METRIC_RETRIES = "upstream.retries";
    static final String METRIC_FAILURES = "upstream.failures";
    static final String METRIC_CALL_DURATION = "upstream.call.duration";

    private final ErrorClassifier classifier;
    private final RetryPolicy policy;
    private final Executor executor;
    private final BackoffScheduler backoff;
    private final MetricFactory metrics;

    /**
     * Creates an executor that backs off with timer-based delays before handing retries to
     * {@code executor}.
     */
    public RetryExecutor(
            ErrorClassifier classifier, RetryPolicy policy, Executor executor, MetricFactory metrics) {
        this(classifier, policy, executor, BackoffScheduler.timer(), metrics);
    }

    public RetryExecutor(
            ErrorClassifier classifier,
            RetryPolicy policy,
            Executor executor,
            BackoffScheduler backoff,
            MetricFactory metrics) {
        if (classifier == null) {
            throw new IllegalArgumentException("classifier must not be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.classifier = classifier;
        this.policy = policy;
        this.executor = executor;
        this.backoff = backoff;
        this.metrics = metrics;
    }

    /**
     * Invokes {@code call} asynchronously, retrying transient failures.
     *
     * @param operationName logical name used in logs and metric tags
     * @param call          the upstream call
     * @param <T>           the response type
     * @return a future completed with the call's result or an {@link UpstreamFailureException}
     */
    public <T> CompletableFuture<T> runWithRetry(String operationName, ExternalApiCall<T> call) {
        if (operationName == null || operationName.isBlank()) {
            throw new IllegalArgumentException("operationName must not be null or blank");
        }
        if (call == null) {
            throw new IllegalArgumentException("call must not be null");
        }
        Invocation<T> invocation = new Invocation<>(operationName, call, new CompletableFuture<>());
        submit(invocation, 1);
        return invocation.result();
    }

    public RetryPolicy policy() {
        return policy;
    }

    /** Hands the attempt to the worker pool with the current thread's correlation context. */
    private <T> void submit(Invocation<T> invocation, int attemptNumber) {
        execute(invocation, CorrelationContextHolder.propagating(executor),
                () -> attempt(invocation, attemptNumber), attemptNumber);
    }

    /**
     * Re-submits once the delay has elapsed. The hand-off to the worker pool happens when the
     * timer fires, so a pool that shuts down meanwhile still fails the invocation.
     */
    private <T> void submitAfter(Invocation<T> invocation, Duration delay, int attemptNumber) {
        CorrelationContext context = CorrelationContextHolder.get().orElse(null);
        execute(invocation, backoff.after(delay),
                () -> CorrelationContextHolder.runWithContext(context, () -> submit(invocation, attemptNumber)),
                attemptNumber);
    }

    private <T> void execute(Invocation<T> invocation, Executor target, Runnable task, int attemptNumber) {
        try {
            target.execute(task);
        } catch (RejectedExecutionException e) {
            if (invocation.result().isDone()) {
                return;
            }
            log.warn("Operation {} attempt {} rejected by executor; giving up",
                    invocation.operationName(), attemptNumber);
            invocation.result().completeExceptionally(new UpstreamFailureException(
                    invocation.operationName(), ErrorKind.UNKNOWN, attemptNumber - 1, e));
        }
    }

    private <T> void attempt(Invocation<T> invocation, int attemptNumber) {
        if (invocation.result().isDone()) {
            log.debug("Operation {} cancelled before attempt {}", invocation.operationName(), attemptNumber);
            return;
        }
        Timer.Sample sample = Timer.start(metrics.registry());
        T value;
        try {
            value = invocation.call().invoke();
        } catch (Exception e) {
            stopTimer(sample, invocation.operationName(), "failure");
            onFailure(invocation, attemptNumber, e);
            return;
        } catch (Error e) {
            stopTimer(sample, invocation.operationName(), "failure");
            invocation.result().completeExceptionally(e);
            throw e;
        }
        stopTimer(sample, invocation.operationName(), "success");
        if (attemptNumber == 1) {
            log.debug("Operation {} succeeded on first attempt", invocation.operationName());
        } else {
            log.info("Operation {} succeeded after {} attempts", invocation.operationName(), attemptNumber);
        }
        invocation.result().complete(value);
    }

    private <T> void onFailure(Invocation<T> invocation, int attemptNumber, Exception error) {
        String operation = invocation.operationName();
        ErrorKind kind = classifier.classify(error);

        if (!kind.isRetryable()) {
            if (kind == ErrorKind.UNKNOWN) {
                log.error("Operation {} failed on attempt {} with unrecognised error {}; not retrying",
                        operation, attemptNumber, describe(error));
            } else {
                log.warn("Operation {} failed on attempt {} with permanent error {}; not retrying",
                        operation, attemptNumber, describe(error));
            }
            fail(invocation, kind, attemptNumber, error);
            return;
        }

        if (attemptNumber > policy.maxRetries()) {
            log.warn("Operation {} exhausted {} retries; last error {} ({})",
                    operation, policy.maxRetries(), describe(error), kind);
            fail(invocation, kind, attemptNumber, error);
            return;
        }

        RetryAttempt retry = new RetryAttempt(operation, attemptNumber, kind, policy.delayFor(attemptNumber));
        log.warn("Operation {} attempt {} failed with {} ({}); retrying in {} ms",
                operation, retry.attemptNumber(), describe(error), retry.lastErrorKind(),
                retry.nextDelay().toMillis());
        metrics.counter(METRIC_RETRIES, "Retries of upstream calls", "operation", operation).increment();
        submitAfter(invocation, retry.nextDelay(), attemptNumber + 1);
    }

    private <T> void fail(Invocation<T> invocation, ErrorKind kind, int attempts, Exception error) {
        metrics.counter(METRIC_FAILURES, "Terminal upstream call failures",
                "operation", invocation.operationName(), "kind", kind.name()).increment();
        invocation.result().completeExceptionally(
                new UpstreamFailureException(invocation.operationName(), kind, attempts, error));
    }

    private void stopTimer(Timer.Sample sample, String operation, String outcome) {
        sample.stop(metrics.timer(METRIC_CALL_DURATION, "Duration of single upstream call attempts",
                "operation", operation, "outcome", outcome));
    }

    /** Status and sub-code only: upstream messages may carry tenant content. */
    private static String describe(Exception error) {
        if (error instanceof ExternalApiException api) {
            return api.subCode() == null
                    ? "status=" + api.statusCode()
                    : "status=" + api.statusCode() + " subCode=" + api.subCode();
        }
        return error.getClass().getSimpleName();
    }

    private record Invocation<T>(String operationName, ExternalApiCall<T> call, CompletableFuture<T> result) {}
}
