package com.clientspaces.resilience;

/**
 * Error raised by the collaboration API client for a non-successful upstream response.
 * <p>
 * Only the HTTP status and the upstream error sub-code are inspected by this layer; the
 * response body never travels with the exception.
 */
public class ExternalApiException extends RuntimeException {

    /** Status value used when the upstream error carried no HTTP status. */
    public static final int NO_STATUS = 0;

    private final int statusCode;
    private final String subCode;

    public ExternalApiException(int statusCode, String subCode) {
        super(subCode == null
                ? "Upstream call failed with status %d".formatted(statusCode)
                : "Upstream call failed with status %d (%s)".formatted(statusCode, subCode));
        this.statusCode = statusCode;
        this.subCode = subCode;
    }

    /** Creates an error that only carries an upstream error code. */
    public static ExternalApiException ofCode(String subCode) {
        return new ExternalApiException(NO_STATUS, subCode);
    }

    public int statusCode() {
        return statusCode;
    }

    /** Upstream error sub-code (e.g. "InvalidAuthenticationToken"), nullable. */
    public String subCode() {
        return subCode;
    }
}
