package com.clientspaces.resilience;

/**
 * Maps an error raised by a protected upstream call to an {@link ErrorKind}.
 * <p>
 * Implementations must be pure: the same error always yields the same kind.
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * Classifies the given error.
     *
     * @param error the error raised by the upstream call (nullable)
     * @return the classification, never null
     */
    ErrorKind classify(Throwable error);
}
