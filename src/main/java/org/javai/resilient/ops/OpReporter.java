package org.javai.resilient.ops;

import org.javai.resilient.Failure;
import org.javai.resilient.breaker.CircuitState;

import java.time.Duration;

/**
 * Receives the events emitted by the resilient client: final failures, retries,
 * breaker transitions, and completed calls.
 * Implementations might emit structured logs or metrics.
 */
public interface OpReporter {

    /**
     * Reports the categorized failure returned to a caller.
     */
    void report(Failure failure);

    /**
     * Reports a failed attempt that will be retried.
     *
     * @param failure The failure of the attempt
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay The delay before the next attempt
     * @param policyId The retry policy being applied
     */
    default void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay, String policyId) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that the retry loop stopped with a failure.
     *
     * @param failure The final failure
     * @param totalAttempts The total number of attempts made
     * @param policyId The retry policy that gave up
     * @param reason Why the policy gave up
     */
    default void reportRetryExhausted(Failure failure, int totalAttempts, String policyId, String reason) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a circuit breaker state transition.
     *
     * @param breakerName The breaker that changed state
     * @param from The previous state
     * @param to The new state
     */
    default void reportStateChange(String breakerName, CircuitState from, CircuitState to) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports a call that received a response.
     */
    default void reportCompleted(CallMetadata call) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing. Useful for testing.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
