package org.javai.resilient.retry;

import org.javai.resilient.Failure;
import org.javai.resilient.Outcome;
import org.javai.resilient.ops.OpReporter;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Executes one logical operation with retry according to a policy.
 * Operates entirely over Outcome values; no exceptions escape.
 *
 * <p>Each failed attempt is handed to the {@link RetryPolicy}. On {@code Retry} the retrier
 * reports the attempt, sleeps, and tries again; on {@code GiveUp} it reports the exhaustion
 * and returns the last failure. An optional budget bounds the total time across all
 * attempts and their delays.</p>
 *
 * <pre>{@code
 * Retrier retrier = Retrier.builder()
 *     .policy(RetryPolicy.linearBackoff("upstream", 4, Duration.ofMillis(200)))
 *     .budget(Duration.ofSeconds(30))
 *     .reporter(reporter)
 *     .build();
 *
 * Outcome<HttpResponse<byte[]>> result = retrier.execute(
 *     "GET https://api.example.com/users",
 *     () -> boundary.call("GET https://api.example.com/users", () -> transport.send(request))
 * );
 * }</pre>
 */
public final class Retrier {

    private final RetryPolicy policy;
    private final OpReporter reporter;
    private final Duration budget;
    private final Sleeper sleeper;
    private final Clock clock;

    private Retrier(RetryPolicy policy, OpReporter reporter, Duration budget, Sleeper sleeper, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.budget = budget;  // null means unlimited
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder {
        private RetryPolicy policy;
        private OpReporter reporter = OpReporter.noOp();
        private Duration budget;
        private Sleeper sleeper = Thread::sleep;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Sets the retry policy (required).
         *
         * @param policy the retry policy to use
         * @return this builder
         */
        public Builder policy(RetryPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter for retry events
         * @return this builder
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets a time budget across all attempts (optional, defaults to unlimited).
         *
         * @param budget maximum time to spend on the operation, retries included
         * @return this builder
         */
        public Builder budget(Duration budget) {
            this.budget = Objects.requireNonNull(budget, "budget must not be null");
            return this;
        }

        /**
         * Sets the sleeper used between attempts.
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Sets the clock used to measure the budget.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Builds the Retrier instance.
         *
         * @return a configured Retrier
         * @throws NullPointerException if policy has not been set
         */
        public Retrier build() {
            Objects.requireNonNull(policy, "policy must be set");
            return new Retrier(policy, reporter, budget, sleeper, clock);
        }
    }

    /**
     * Executes an operation with retry according to the configured policy.
     *
     * @param operation The operation name for reporting
     * @param attempt A supplier that performs one attempt
     * @return The final Outcome after success or retry exhaustion
     */
    public <T> Outcome<T> execute(String operation, Supplier<Outcome<T>> attempt) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        return executeWithContext(operation, context -> attempt.get());
    }

    /**
     * Executes an operation with retry, handing each attempt its {@link RetryContext} so it
     * can bound itself by the remaining budget.
     *
     * @param operation The operation name for reporting
     * @param attempt A function that performs one attempt
     * @return The final Outcome after success or retry exhaustion
     */
    public <T> Outcome<T> executeWithContext(String operation, Function<RetryContext, Outcome<T>> attempt) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        RetryContext context = RetryContext.first(clock, budget);
        Outcome<T> result = attempt.apply(context);

        while (result instanceof Outcome.Fail<T> fail) {
            Failure failure = fail.failure();
            context = context.refreshed(clock);
            RetryDecision decision = policy.decide(context, failure);

            if (decision instanceof RetryDecision.GiveUp giveUp) {
                reporter.reportRetryExhausted(failure, context.attemptNumber(), policy.id(), giveUp.reason());
                return result;
            }

            Duration delay = ((RetryDecision.Retry) decision).delay();
            reporter.reportRetryAttempt(failure, context.attemptNumber(), delay, policy.id());
            if (!sleep(delay)) {
                reporter.reportRetryExhausted(failure, context.attemptNumber(), policy.id(), "interrupted");
                return result;
            }
            context = context.next(clock);
            result = attempt.apply(context);
        }

        return result;
    }

    public RetryPolicy policy() {
        return policy;
    }

    private static long toMillisSaturated(Duration duration) {
        try {
            return duration.toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Sleeps between attempts.
     *
     * @return false if the thread was interrupted, in which case the loop stops
     */
    private boolean sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(toMillisSaturated(duration));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Pauses the calling thread between attempts. Replaceable for tests.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
