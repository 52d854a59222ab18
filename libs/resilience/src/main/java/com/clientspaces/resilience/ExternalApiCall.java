package com.clientspaces.resilience;

/**
 * A single call into the external collaboration API.
 * <p>
 * The call owns its own per-attempt timeout; a timed-out attempt surfaces as a timeout
 * exception and is classified as transient.
 *
 * @param <T> the response type
 */
@FunctionalInterface
public interface ExternalApiCall<T> {

    /**
     * Performs the call.
     *
     * @return the upstream response
     * @throws Exception any upstream or transport failure
     */
    T invoke() throws Exception;
}
