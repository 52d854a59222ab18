package com.clientspaces.quotaservice.infrastructure.web;

import com.clientspaces.observability.CorrelationContextHolder;
import com.clientspaces.quota.OperationError;
import com.clientspaces.quota.OperationError.RateLimited;
import com.clientspaces.quota.OperationError.StaticLimitExceeded;
import com.clientspaces.quota.OperationError.UpstreamFailed;
import com.clientspaces.quota.OperationError.UsageBudgetExceeded;
import com.clientspaces.quota.UnknownPlanTierException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions and operation errors to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://clientspaces.dev/errors/usage-budget-exceeded",
 *   "title": "Usage Budget Exceeded",
 *   "status": 429,
 *   "detail": "Monthly limit of 20 messages exceeded for Starter plan. Upgrade to Professional to continue.",
 *   "code": "USAGE_BUDGET_EXCEEDED",
 *   "timestamp": "2026-03-14T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Upstream failures never expose upstream status codes or messages. The detail only carries
 * the correlation ID as a support reference.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://clientspaces.dev/errors/";

    @ExceptionHandler(OperationFailedException.class)
    public ResponseEntity<ProblemDetail> handleOperationFailed(OperationFailedException ex) {
        OperationError error = ex.error();
        HttpHeaders headers = new HttpHeaders();
        ProblemDetail problem;

        if (error instanceof RateLimited rateLimited) {
            problem = problem(HttpStatus.TOO_MANY_REQUESTS, "Rate Limited", "rate-limited", error);
            problem.setProperty("retryAfterSeconds", rateLimited.retryAfterSeconds());
            headers.set(HttpHeaders.RETRY_AFTER, Long.toString(rateLimited.retryAfterSeconds()));
        } else if (error instanceof UsageBudgetExceeded budget) {
            problem = problem(HttpStatus.TOO_MANY_REQUESTS, "Usage Budget Exceeded", "usage-budget-exceeded", error);
            problem.setProperty("budgetKind", budget.budgetKind().name());
            problem.setProperty("current", budget.current());
            problem.setProperty("limit", budget.limit());
            problem.setProperty("planTier", budget.planTier());
            problem.setProperty("upgradeTier", budget.upgradeTier());
        } else if (error instanceof StaticLimitExceeded cap) {
            problem = problem(HttpStatus.FORBIDDEN, "Plan Limit Reached", "static-limit-exceeded", error);
            problem.setProperty("resourceKind", cap.resourceKind().name());
            problem.setProperty("current", cap.current());
            problem.setProperty("limit", cap.limit());
            problem.setProperty("planTier", cap.planTier());
            problem.setProperty("upgradeTier", cap.upgradeTier());
        } else if (error instanceof UpstreamFailed upstream) {
            problem = problem(HttpStatus.BAD_GATEWAY, "Upstream Failure", "upstream-failed", error);
            problem.setProperty("attempts", upstream.attempts());
        } else {
            throw new IllegalStateException("Unhandled operation error " + error.code());
        }

        enrichWithCorrelation(problem);
        if (error instanceof UpstreamFailed upstream) {
            // the reference shown in the message wins over the request context
            problem.setProperty("correlationId", upstream.correlationId());
        }
        return ResponseEntity.status(problem.getStatus()).headers(headers).body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(UnknownPlanTierException.class)
    public ProblemDetail handleUnknownPlanTier(UnknownPlanTierException ex) {
        log.error("Tenant subscription references unknown plan tier '{}'", ex.tier());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "The subscription plan could not be resolved");
        problem.setTitle("Plan Configuration Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "plan-configuration"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, OperationError error) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, error.message());
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("code", error.code());
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
