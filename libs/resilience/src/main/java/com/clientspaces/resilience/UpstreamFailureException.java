package com.clientspaces.resilience;

/**
 * Terminal failure of a protected upstream call.
 * <p>
 * Carries the last observed error and the number of calls made. The history of earlier
 * attempts only exists in the retry logs.
 */
public class UpstreamFailureException extends RuntimeException {

    private final String operationName;
    private final ErrorKind errorKind;
    private final int attempts;

    public UpstreamFailureException(
            String operationName, ErrorKind errorKind, int attempts, Throwable lastError) {
        super("Operation '%s' failed after %d attempt(s) with %s error"
                .formatted(operationName, attempts, errorKind), lastError);
        this.operationName = operationName;
        this.errorKind = errorKind;
        this.attempts = attempts;
    }

    public String operationName() {
        return operationName;
    }

    /** Classification of the last observed error. */
    public ErrorKind errorKind() {
        return errorKind;
    }

    /** Total number of calls made, including the initial one. */
    public int attempts() {
        return attempts;
    }
}
