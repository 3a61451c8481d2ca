package org.sprig.compiler.api;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The outcome of a scanning operation: either a value or the {@link ScanError} that aborted it.
 *
 * @param <T> The type of the successful value.
 */
public sealed interface ScanResult<T> permits ScanResult.Success, ScanResult.Failure {

    static <T> ScanResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ScanResult<T> failure(ScanError error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    /**
     * @return The error if this result is a failure, otherwise empty.
     */
    Optional<ScanError> failure();

    /**
     * Returns the value, or throws if this result is a failure.
     *
     * @return The successful value.
     * @throws ScanException carrying the error of a failed result.
     */
    T getOrThrow();

    /**
     * Transforms the value of a successful result. A failure is passed on unchanged.
     *
     * @param mapper The function applied to the value.
     * @param <U> The new value type.
     * @return The mapped result.
     */
    <U> ScanResult<U> map(Function<? super T, ? extends U> mapper);

    /**
     * A successful result.
     * @param value The produced value.
     */
    record Success<T>(T value) implements ScanResult<T> {

        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<ScanError> failure() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public <U> ScanResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }
    }

    /**
     * A failed result.
     * @param error The error that aborted the operation.
     */
    record Failure<T>(ScanError error) implements ScanResult<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<ScanError> failure() {
            return Optional.of(error);
        }

        @Override
        public T getOrThrow() {
            throw new ScanException(error);
        }

        @Override
        public <U> ScanResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(error);
        }
    }
}
