package org.javai.resilient.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Context provided to retry policies and to each attempt.
 *
 * @param attemptNumber The current attempt number (1-based)
 * @param startedAt When the first attempt began
 * @param elapsed Time elapsed since the first attempt, measured when this context was created
 * @param budget Total time allowed across all attempts (null if unlimited)
 */
public record RetryContext(
        int attemptNumber,
        Instant startedAt,
        Duration elapsed,
        Duration budget
) {
    public RetryContext {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("attemptNumber must be >= 1");
        }
        Objects.requireNonNull(startedAt, "startedAt must not be null");
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static RetryContext first(Clock clock, Duration budget) {
        return new RetryContext(1, clock.instant(), Duration.ZERO, budget);
    }

    /**
     * Returns this context with the elapsed time brought up to date, same attempt number.
     */
    public RetryContext refreshed(Clock clock) {
        return new RetryContext(attemptNumber, startedAt, Duration.between(startedAt, clock.instant()), budget);
    }

    /**
     * Returns the context of the next attempt.
     */
    public RetryContext next(Clock clock) {
        return new RetryContext(attemptNumber + 1, startedAt, Duration.between(startedAt, clock.instant()), budget);
    }

    public boolean hasBudgetRemaining() {
        return budget == null || budget.compareTo(elapsed) > 0;
    }

    /**
     * Returns the time left in the budget, never negative, or null if the budget is unlimited.
     */
    public Duration remainingBudget() {
        if (budget == null) {
            return null;
        }
        Duration remaining = budget.minus(elapsed);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }
}
