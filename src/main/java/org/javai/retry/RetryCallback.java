package org.javai.retry;

/**
 * Lifecycle callback receiving the result and a snapshot of the execution's progress.
 *
 * <p>Whatever this callback throws ends the execution; the failure is reported wrapped in the
 * {@link org.javai.retry.exception.CallbackException} subtype matching the callback's category.
 *
 * @param <T> The type of the operation's result
 */
@FunctionalInterface
public interface RetryCallback<T> {

    void accept(RetryResult<T> result, RetryContext context) throws Exception;
}
