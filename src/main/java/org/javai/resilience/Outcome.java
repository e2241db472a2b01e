package org.javai.resilience;

import java.util.Objects;
import java.util.function.Function;

/**
 * Represents the outcome of an execution that may fail.
 * Either {@link Ok} containing a successful value, or {@link Fail} containing a {@link Failure}.
 *
 * <p>Produced by {@link Policy#attempt}, for callers that prefer branching on a value to
 * catching exceptions:</p>
 * <pre>{@code
 * Outcome<Forecast> outcome = Policies.externalApi().attempt(() -> weather.fetch(city));
 * if (outcome.isFail()) {
 *     Failure failure = ((Outcome.Fail<Forecast>) outcome).failure();
 *     ...
 * }
 * }</pre>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value (may be null)
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
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
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public Outcome<T> recover(Function<? super Failure, ? extends T> recovery) {
            return this;
        }
    }

    /**
     * A failed outcome containing failure details.
     *
     * @param failure the failure details
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
        public boolean isFail() {
            return true;
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
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public Outcome<T> recover(Function<? super Failure, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(failure));
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);

    // Transformations
    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    // Recovery
    Outcome<T> recover(Function<? super Failure, ? extends T> recovery);

    // Static factories
    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }
}
