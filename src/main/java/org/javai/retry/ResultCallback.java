package org.javai.retry;

/**
 * Lifecycle callback that only needs the result.
 */
@FunctionalInterface
public interface ResultCallback<T> {

    void accept(RetryResult<T> result) throws Exception;
}
