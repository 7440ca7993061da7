package org.javai.resilient;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of an outbound call: either {@link Ok} carrying the value, or {@link Fail}
 * carrying exactly one categorized {@link Failure}.
 *
 * <p>Operational failures never escape the client as exceptions; callers inspect the outcome
 * or call {@link #getOrThrow()} to convert a failure into an {@link OutcomeFailedException}.</p>
 *
 * <pre>{@code
 * Outcome<HttpResponse<byte[]>> outcome = client.send(request);
 * if (outcome instanceof Outcome.Fail<HttpResponse<byte[]>> fail
 *         && fail.failure().code() == FailureCode.NOT_FOUND) {
 *     return Optional.empty();
 * }
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Optional<Failure> findFailure() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public Outcome<T> recover(Function<? super Failure, ? extends T> recovery) {
            return this;
        }

        @Override
        public Outcome<T> mapFailure(Function<? super Failure, Failure> mapper) {
            return this;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail) {
            Objects.requireNonNull(onOk);
            return onOk.apply(value);
        }
    }

    /**
     * A failed outcome containing failure details.
     *
     * @param failure the categorized failure
     */
    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public Optional<Failure> findFailure() {
            return Optional.of(failure);
        }

        @Override
        public T getOrThrow() {
            throw new OutcomeFailedException(failure);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public Outcome<T> recover(Function<? super Failure, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(failure));
        }

        @Override
        public Outcome<T> mapFailure(Function<? super Failure, Failure> mapper) {
            Objects.requireNonNull(mapper);
            return new Fail<>(mapper.apply(failure));
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail) {
            Objects.requireNonNull(onFail);
            return onFail.apply(failure);
        }
    }

    // Query methods
    boolean isOk();

    default boolean isFail() {
        return !isOk();
    }

    /**
     * Returns the failure of a failed outcome, or empty for a successful one.
     */
    Optional<Failure> findFailure();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U> flatMap(Function<? super T, ? extends Outcome<U>> mapper);

    /**
     * Rewrites the failure of a failed outcome, e.g. to attach context. Successful outcomes
     * are returned unchanged.
     */
    Outcome<T> mapFailure(Function<? super Failure, Failure> mapper);

    // Recovery
    Outcome<T> recover(Function<? super Failure, ? extends T> recovery);

    /**
     * Collapses both branches into a single value.
     */
    <R> R fold(Function<? super T, ? extends R> onOk, Function<? super Failure, ? extends R> onFail);

    // Static factories
    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }
}
