package org.javai.retry;

import org.javai.retry.exception.RetryFailedException;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of a retry execution: either the operation's result or the terminal error.
 *
 * <p>The executor fills the result in while it runs; once returned to the caller it is
 * never changed again. Callbacks receive the live instance but cannot modify it.
 *
 * @param <T> The type of the operation's result ({@link Void} for actions)
 */
public final class RetryResult<T> {

    private T result;
    private Throwable error;

    RetryResult() {
    }

    /**
     * The value produced by the most recent successful attempt, or null.
     */
    public T result() {
        return result;
    }

    /**
     * The terminal error, or null if the execution succeeded.
     */
    public Throwable error() {
        return error;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    public Optional<Throwable> errorIfPresent() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the result or throws {@link RetryFailedException} carrying the terminal error.
     */
    public T getOrThrow() {
        if (error != null) {
            throw new RetryFailedException(error);
        }
        return result;
    }

    public T getOrElse(T defaultValue) {
        return error == null ? result : defaultValue;
    }

    public T getOrElseGet(Supplier<? extends T> supplier) {
        return error == null ? result : supplier.get();
    }

    void setResult(T result) {
        this.result = result;
    }

    void setError(Throwable error) {
        this.error = error;
    }

    @Override
    public String toString() {
        return error == null
                ? "RetryResult[success, result=" + result + "]"
                : "RetryResult[failure, error=" + error + "]";
    }
}
