package at.sv.gateway.api;

import java.util.function.Function;

/**
 * Outcome of a single Home Assistant call. Callers decide how to report a failure instead of catching exceptions.
 *
 * @param <T> the type of the successful value
 */
public sealed interface ApiResult<T> permits ApiResult.Success, ApiResult.Failure {

    static <T> ApiResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ApiResult<T> failure(String message, Throwable cause) {
        return new Failure<>(message, cause);
    }

    boolean isSuccess();

    /**
     * @return the value of a successful call
     * @throws IllegalStateException if the call failed
     */
    T getValue();

    /**
     * @return the failure message, or null for a successful call
     */
    String getFailureMessage();

    <R> ApiResult<R> map(Function<? super T, ? extends R> mapper);

    record Success<T>(T value) implements ApiResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public String getFailureMessage() {
            return null;
        }

        @Override
        public <R> ApiResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }
    }

    record Failure<T>(String message, Throwable cause) implements ApiResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("No value for failed call: " + message, cause);
        }

        @Override
        public String getFailureMessage() {
            return message;
        }

        @Override
        public <R> ApiResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(message, cause);
        }
    }
}
