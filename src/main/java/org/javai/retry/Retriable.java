package org.javai.retry;

import java.util.function.Predicate;

/**
 * A blocking retry execution of one operation.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryResult<Order> result = RetryBuilder.create()
 *     .maxTryCount(3)
 *     .retryOn(IOException.class)
 *     .build(() -> orders.fetch(orderId))
 *     .onRetry((r, context) -> log.info("retry {}", context.retryCount()))
 *     .run();
 * }</pre>
 *
 * @param <T> The type of the operation's result
 */
public interface Retriable<T> {

    /**
     * Runs the operation on the calling thread until it succeeds or a bound is reached.
     * Never throws for failures of the operation or of callbacks; inspect the result instead.
     */
    default RetryResult<T> run() {
        return run(null);
    }

    /**
     * Runs the operation until it succeeds and {@code condition} accepts the result, or a bound
     * is reached. A rejected result counts as an unsuccessful attempt.
     *
     * @param condition Acceptance condition; null accepts every successful attempt
     */
    RetryResult<T> run(Predicate<? super RetryResult<T>> condition);

    /**
     * Returns an asynchronous execution of the same operation, options and callbacks.
     */
    AsyncRetriable<T> asAsync();

    /**
     * Registers a callback to run before every retry.
     */
    Retriable<T> onRetry(RetryHook<T> hook);

    /**
     * Registers a callback to run after the final successful attempt.
     */
    Retriable<T> onSuccess(RetryHook<T> hook);

    /**
     * Registers a callback to run when the execution ends without success.
     */
    Retriable<T> onFailure(RetryHook<T> hook);

    default Retriable<T> onRetry(ResultCallback<T> callback) {
        return onRetry(RetryHook.of(callback));
    }

    default Retriable<T> onRetry(RetryCallback<T> callback) {
        return onRetry(RetryHook.of(callback));
    }

    default Retriable<T> onSuccess(ResultCallback<T> callback) {
        return onSuccess(RetryHook.of(callback));
    }

    default Retriable<T> onSuccess(RetryCallback<T> callback) {
        return onSuccess(RetryHook.of(callback));
    }

    default Retriable<T> onFailure(ResultCallback<T> callback) {
        return onFailure(RetryHook.of(callback));
    }

    default Retriable<T> onFailure(RetryCallback<T> callback) {
        return onFailure(RetryHook.of(callback));
    }
}
