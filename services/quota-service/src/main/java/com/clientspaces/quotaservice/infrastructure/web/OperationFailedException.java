package com.clientspaces.quotaservice.infrastructure.web;

import com.clientspaces.quota.OperationError;

/**
 * Carries an {@link OperationError} out of a controller so {@link GlobalExceptionHandler} can
 * render it.
 */
public class OperationFailedException extends RuntimeException {

    private final transient OperationError error;

    public OperationFailedException(OperationError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public OperationError error() {
        return error;
    }
}
