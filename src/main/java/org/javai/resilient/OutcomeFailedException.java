package org.javai.resilient;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome.
 * Carries the categorized {@link Failure} so exception-style callers keep the full taxonomy.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super(failure.code() + ": " + failure.message(), failure.exception());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }

    /**
     * Shortcut for {@code failure().code()}.
     */
    public FailureCode code() {
        return failure.code();
    }
}
