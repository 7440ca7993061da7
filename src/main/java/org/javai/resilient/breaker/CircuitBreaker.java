package org.javai.resilient.breaker;

import org.javai.resilient.Failure;
import org.javai.resilient.Outcome;
import org.javai.resilient.ops.OpReporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A thread-safe circuit breaker gating calls to a single upstream.
 *
 * <pre>
 *     CLOSED ──(consecutive failures >= threshold)──> OPEN
 *        ^                                             │
 *        │                                   (open duration elapsed,
 *  (all trials succeed)                        next call admitted)
 *        │                                             │
 *        └─────────────── HALF_OPEN <──────────────────┘
 *                            │
 *                     (trial fails) ──> OPEN (timer restarts)
 * </pre>
 *
 * <p>Calls are not serialized: in {@code CLOSED} any number of calls run concurrently. Only
 * the accounting is guarded, by a single lock, so state reads and counter updates are atomic
 * with respect to each other.</p>
 *
 * <p>Each admitted call is tagged with the generation it was admitted in. A generation ends
 * on every state transition; results from an earlier generation are ignored, so a slow call
 * that started while {@code CLOSED} cannot disturb the trial accounting of a later
 * {@code HALF_OPEN}.</p>
 *
 * <p>Only failures matching the failure predicate count against the breaker. By default that
 * is {@link Failure#isRetryable()}: transport errors and 5xx answers. A terminal 4xx means the
 * upstream is healthy.</p>
 */
public final class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration openDuration;
    private final int halfOpenMaxCalls;
    private final Predicate<Failure> failurePredicate;
    private final OpReporter reporter;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    // Guarded by lock
    private CircuitState state = CircuitState.CLOSED;
    private long generation;
    private int consecutiveFailures;
    private int trialsAdmitted;
    private int trialsSucceeded;
    private Instant openedAt;

    private CircuitBreaker(Builder builder) {
        this.name = builder.name;
        this.failureThreshold = builder.failureThreshold;
        this.openDuration = builder.openDuration;
        this.halfOpenMaxCalls = builder.halfOpenMaxCalls;
        this.failurePredicate = builder.failurePredicate;
        this.reporter = builder.reporter;
        this.clock = builder.clock;
    }

    /**
     * Creates a builder for configuring a CircuitBreaker.
     *
     * @param name the breaker name used in transition events
     * @return a new builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder for configuring a CircuitBreaker.
     *
     * <pre>{@code
     * CircuitBreaker breaker = CircuitBreaker.builder("payments")
     *     .failureThreshold(5)
     *     .openDuration(Duration.ofSeconds(30))
     *     .reporter(new Log4jOpReporter())
     *     .build();
     * }</pre>
     */
    public static final class Builder {
        private final String name;
        private int failureThreshold = 10;
        private Duration openDuration = Duration.ofMinutes(1);
        private int halfOpenMaxCalls = 1;
        private Predicate<Failure> failurePredicate = Failure::isRetryable;
        private OpReporter reporter = OpReporter.noOp();
        private Clock clock = Clock.systemUTC();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name must not be null");
        }

        /**
         * Sets the number of consecutive failures that trips the breaker (default 10).
         */
        public Builder failureThreshold(int failureThreshold) {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be >= 1, was: " + failureThreshold);
            }
            this.failureThreshold = failureThreshold;
            return this;
        }

        /**
         * Sets how long the breaker stays open before admitting a trial call (default 1 minute).
         */
        public Builder openDuration(Duration openDuration) {
            Objects.requireNonNull(openDuration, "openDuration must not be null");
            if (openDuration.isNegative() || openDuration.isZero()) {
                throw new IllegalArgumentException("openDuration must be positive, was: " + openDuration);
            }
            this.openDuration = openDuration;
            return this;
        }

        /**
         * Sets how many trial calls are admitted while half-open (default 1).
         */
        public Builder halfOpenMaxCalls(int halfOpenMaxCalls) {
            if (halfOpenMaxCalls < 1) {
                throw new IllegalArgumentException("halfOpenMaxCalls must be >= 1, was: " + halfOpenMaxCalls);
            }
            this.halfOpenMaxCalls = halfOpenMaxCalls;
            return this;
        }

        /**
         * Sets which failures count against the breaker (default: retryable failures).
         */
        public Builder failurePredicate(Predicate<Failure> failurePredicate) {
            this.failurePredicate = Objects.requireNonNull(failurePredicate, "failurePredicate must not be null");
            return this;
        }

        /**
         * Sets the reporter notified of state transitions (optional, defaults to no-op).
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets the clock used for the open duration (for testing).
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        public CircuitBreaker build() {
            return new CircuitBreaker(this);
        }
    }

    /**
     * Executes a call through the breaker.
     *
     * <p>If the breaker rejects the call, returns a {@code BREAKER_OPEN} failure without
     * invoking {@code call}. Otherwise invokes it and records its outcome. A runtime exception
     * thrown by the call counts as a failure and is rethrown.</p>
     *
     * @param operation the operation name attached to a rejection
     * @param call the call to gate; it performs one logical operation, retries included
     * @return the call's outcome, or a {@code BREAKER_OPEN} failure
     */
    public <T> Outcome<T> execute(String operation, Supplier<Outcome<T>> call) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(call, "call must not be null");

        long admittedIn = tryAcquirePermission();
        if (admittedIn < 0) {
            return Outcome.fail(Failure.breakerOpen(operation, name));
        }

        Outcome<T> result;
        try {
            result = call.get();
        } catch (RuntimeException e) {
            onResult(admittedIn, false);
            throw e;
        }

        boolean failed = result.findFailure().filter(failurePredicate).isPresent();
        onResult(admittedIn, !failed);
        return result;
    }

    /**
     * Returns the current state. An open breaker whose open duration has elapsed still reports
     * {@code OPEN} until the next call is admitted as a trial.
     */
    public CircuitState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the consecutive failures counted in the current {@code CLOSED} period.
     */
    public int consecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    /**
     * Admits or rejects a call.
     *
     * @return the generation the call is admitted in, or -1 if rejected
     */
    private long tryAcquirePermission() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED:
                    return generation;
                case OPEN:
                    if (clock.instant().isBefore(openedAt.plus(openDuration))) {
                        return -1;
                    }
                    transitionTo(CircuitState.HALF_OPEN);
                    trialsAdmitted++;
                    return generation;
                case HALF_OPEN:
                    if (trialsAdmitted >= halfOpenMaxCalls) {
                        return -1;
                    }
                    trialsAdmitted++;
                    return generation;
                default:
                    throw new IllegalStateException("Unknown state: " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onResult(long admittedIn, boolean success) {
        lock.lock();
        try {
            if (admittedIn != generation) {
                return;
            }
            if (state == CircuitState.CLOSED) {
                if (success) {
                    consecutiveFailures = 0;
                } else if (++consecutiveFailures >= failureThreshold) {
                    transitionTo(CircuitState.OPEN);
                }
            } else if (state == CircuitState.HALF_OPEN) {
                if (!success) {
                    transitionTo(CircuitState.OPEN);
                } else if (++trialsSucceeded >= halfOpenMaxCalls) {
                    transitionTo(CircuitState.CLOSED);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    // Caller holds lock
    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        generation++;
        consecutiveFailures = 0;
        trialsAdmitted = 0;
        trialsSucceeded = 0;
        if (next == CircuitState.OPEN) {
            openedAt = clock.instant();
        }
        reportStateChange(previous, next);
    }

    // A failing reporter must not leave a transition half applied
    private void reportStateChange(CircuitState previous, CircuitState next) {
        try {
            reporter.reportStateChange(name, previous, next);
        } catch (RuntimeException e) {
            System.err.println("OpReporter.reportStateChange failed for breaker " + name + ": " + e.getMessage());
        }
    }
}
