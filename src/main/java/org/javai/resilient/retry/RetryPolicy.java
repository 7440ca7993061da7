package org.javai.resilient.retry;

import org.javai.resilient.Failure;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides whether and when to retry after a failed attempt.
 *
 * <p>The built-in policies only retry failures where {@link Failure#isRetryable()} holds
 * (transport errors and 5xx answers). A terminal failure is surfaced immediately, whatever
 * attempts remain.</p>
 */
public interface RetryPolicy {

    /**
     * A unique identifier for this policy, used in reporting.
     */
    String id();

    /**
     * Evaluates a failure and decides whether to retry.
     *
     * @param context The context of the attempt that just failed
     * @param failure The failure of that attempt
     * @return Retry with a delay, or GiveUp
     */
    RetryDecision decide(RetryContext context, Failure failure);

    /**
     * Creates a policy that never retries.
     */
    static RetryPolicy noRetry() {
        return new RetryPolicy() {
            @Override
            public String id() {
                return "no-retry";
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                return RetryDecision.GiveUp.because("no-retry policy");
            }
        };
    }

    /**
     * Creates a policy that waits the same delay before every retry.
     */
    static RetryPolicy fixed(String id, int maxAttempts, Duration delay) {
        Objects.requireNonNull(delay);
        return linearOrFixed(id, maxAttempts, delay, false);
    }

    /**
     * Creates a policy with linearly increasing delays: after attempt {@code n} fails, waits
     * {@code baseDelay * n} before attempt {@code n + 1}.
     *
     * @param id policy id for reporting
     * @param maxAttempts total attempts allowed, first attempt included (must be >= 1)
     * @param baseDelay delay after the first failed attempt
     */
    static RetryPolicy linearBackoff(String id, int maxAttempts, Duration baseDelay) {
        Objects.requireNonNull(baseDelay);
        return linearOrFixed(id, maxAttempts, baseDelay, true);
    }

    private static RetryPolicy linearOrFixed(String id, int maxAttempts, Duration delay, boolean linear) {
        Objects.requireNonNull(id);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was: " + maxAttempts);
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative, was: " + delay);
        }

        return new RetryPolicy() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public RetryDecision decide(RetryContext context, Failure failure) {
                if (!failure.isRetryable()) {
                    return RetryDecision.GiveUp.because("failure is not retryable");
                }
                if (context.attemptNumber() >= maxAttempts) {
                    return RetryDecision.GiveUp.because("max attempts reached");
                }
                if (!context.hasBudgetRemaining()) {
                    return RetryDecision.GiveUp.because("budget exhausted");
                }

                Duration next = linear ? scaled(delay, context.attemptNumber()) : delay;

                // The delay must leave time for another attempt
                Duration remaining = context.remainingBudget();
                if (remaining != null && next.compareTo(remaining) >= 0) {
                    return RetryDecision.GiveUp.because("budget exhausted");
                }
                return RetryDecision.Retry.after(next);
            }
        };
    }

    /**
     * {@code delay * factor}, saturating at the largest representable duration.
     */
    private static Duration scaled(Duration delay, int factor) {
        try {
            return delay.multipliedBy(factor);
        } catch (ArithmeticException e) {
            return Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);
        }
    }
}
