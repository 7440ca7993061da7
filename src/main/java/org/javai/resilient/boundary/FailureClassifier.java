package org.javai.resilient.boundary;

import org.javai.resilient.Failure;

/**
 * Classifies a transport exception into a categorized failure.
 * Implementations must be deterministic and side-effect free.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an exception raised while performing an operation.
     *
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return A categorized Failure
     */
    Failure classify(String operation, Throwable throwable);
}
