package org.javai.retry;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous lifecycle callback. The execution waits for the returned stage before it moves on;
 * an exceptionally completed stage counts as a callback failure.
 *
 * @param <T> The type of the operation's result
 */
@FunctionalInterface
public interface AsyncRetryCallback<T> {

    CompletionStage<?> apply(RetryResult<T> result, RetryContext context);
}
