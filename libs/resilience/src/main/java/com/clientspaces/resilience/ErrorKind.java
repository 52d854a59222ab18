package com.clientspaces.resilience;

/**
 * Classification of a failed upstream call.
 */
public enum ErrorKind {

    /** Expected to resolve itself on retry (throttling, temporary outage, expired token). */
    TRANSIENT,

    /** Will not resolve by retrying (bad request, forbidden, not found). */
    PERMANENT,

    /** Unrecognised error shape. Treated as permanent: never retried. */
    UNKNOWN;

    /** Whether a failure of this kind may be retried. */
    public boolean isRetryable() {
        return this == TRANSIENT;
    }
}
