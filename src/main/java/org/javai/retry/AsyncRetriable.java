package org.javai.retry;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * An asynchronous retry execution of one operation.
 *
 * <p>No thread is blocked while waiting between attempts. The returned future always completes
 * normally with a {@link RetryResult}; failures of the operation and of callbacks, bound
 * violations and cancellation all end up in {@link RetryResult#error()}.
 *
 * <p>Every run accepts a {@link CancellationToken} and the {@link Executor} on which the
 * execution resumes after each wait or asynchronous step. Omitted, they default to
 * {@link CancellationToken#none()} and the task's configured executor.
 *
 * @param <T> The type of the operation's result
 */
public interface AsyncRetriable<T> {

    /**
     * Runs until {@code condition} accepts a successful result or a bound is reached.
     *
     * @param condition Acceptance condition; null accepts every successful attempt
     * @param cancellation Cooperative cancellation signal
     * @param resumeOn Executor on which the execution continues after every suspension
     */
    CompletableFuture<RetryResult<T>> runAsyncUntil(AsyncAssertion<T> condition, CancellationToken cancellation,
                                                    Executor resumeOn);

    /**
     * Runs with the task's configured executor.
     */
    CompletableFuture<RetryResult<T>> runAsyncUntil(AsyncAssertion<T> condition, CancellationToken cancellation);

    default CompletableFuture<RetryResult<T>> runAsyncUntil(AsyncAssertion<T> condition) {
        return runAsyncUntil(condition, CancellationToken.none());
    }

    default CompletableFuture<RetryResult<T>> runAsync() {
        return runAsyncUntil(null, CancellationToken.none());
    }

    default CompletableFuture<RetryResult<T>> runAsync(CancellationToken cancellation) {
        return runAsyncUntil(null, cancellation);
    }

    default CompletableFuture<RetryResult<T>> runAsync(CancellationToken cancellation, Executor resumeOn) {
        return runAsyncUntil(null, cancellation, resumeOn);
    }

    default CompletableFuture<RetryResult<T>> runAsync(Predicate<? super RetryResult<T>> condition) {
        return runAsyncUntil(AsyncAssertion.of(condition), CancellationToken.none());
    }

    default CompletableFuture<RetryResult<T>> runAsync(Predicate<? super RetryResult<T>> condition,
                                                       CancellationToken cancellation) {
        return runAsyncUntil(AsyncAssertion.of(condition), cancellation);
    }

    default CompletableFuture<RetryResult<T>> runAsync(Predicate<? super RetryResult<T>> condition,
                                                       CancellationToken cancellation, Executor resumeOn) {
        return runAsyncUntil(AsyncAssertion.of(condition), cancellation, resumeOn);
    }

    AsyncRetriable<T> onRetry(RetryHook<T> hook);

    AsyncRetriable<T> onSuccess(RetryHook<T> hook);

    AsyncRetriable<T> onFailure(RetryHook<T> hook);

    default AsyncRetriable<T> onRetry(ResultCallback<T> callback) {
        return onRetry(RetryHook.of(callback));
    }

    default AsyncRetriable<T> onRetry(RetryCallback<T> callback) {
        return onRetry(RetryHook.of(callback));
    }

    default AsyncRetriable<T> onRetryAsync(Function<? super RetryResult<T>, ? extends CompletionStage<?>> callback) {
        return onRetry(RetryHook.ofAsync(callback));
    }

    default AsyncRetriable<T> onRetryAsync(AsyncRetryCallback<T> callback) {
        return onRetry(RetryHook.ofAsync(callback));
    }

    default AsyncRetriable<T> onSuccess(ResultCallback<T> callback) {
        return onSuccess(RetryHook.of(callback));
    }

    default AsyncRetriable<T> onSuccess(RetryCallback<T> callback) {
        return onSuccess(RetryHook.of(callback));
    }

    default AsyncRetriable<T> onSuccessAsync(Function<? super RetryResult<T>, ? extends CompletionStage<?>> callback) {
        return onSuccess(RetryHook.ofAsync(callback));
    }

    default AsyncRetriable<T> onSuccessAsync(AsyncRetryCallback<T> callback) {
        return onSuccess(RetryHook.ofAsync(callback));
    }

    default AsyncRetriable<T> onFailure(ResultCallback<T> callback) {
        return onFailure(RetryHook.of(callback));
    }

    default AsyncRetriable<T> onFailure(RetryCallback<T> callback) {
        return onFailure(RetryHook.of(callback));
    }

    default AsyncRetriable<T> onFailureAsync(Function<? super RetryResult<T>, ? extends CompletionStage<?>> callback) {
        return onFailure(RetryHook.ofAsync(callback));
    }

    default AsyncRetriable<T> onFailureAsync(AsyncRetryCallback<T> callback) {
        return onFailure(RetryHook.ofAsync(callback));
    }
}
