package org.javai.retry;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * A registered lifecycle callback, either synchronous or asynchronous.
 *
 * <p>Every registration shape offered by {@link Retriable} and {@link AsyncRetriable} is
 * normalised into one of these two variants when it is registered.
 */
public sealed interface RetryHook<T> permits RetryHook.Sync, RetryHook.Suspending {

    /**
     * A callback that completes before it returns.
     */
    record Sync<T>(RetryCallback<T> callback) implements RetryHook<T> {
        public Sync {
            Objects.requireNonNull(callback, "callback must not be null");
        }
    }

    /**
     * A callback that completes when its returned stage completes.
     */
    record Suspending<T>(AsyncRetryCallback<T> callback) implements RetryHook<T> {
        public Suspending {
            Objects.requireNonNull(callback, "callback must not be null");
        }
    }

    static <T> RetryHook<T> of(RetryCallback<T> callback) {
        return new Sync<>(callback);
    }

    static <T> RetryHook<T> of(ResultCallback<T> callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        return new Sync<>((result, context) -> callback.accept(result));
    }

    static <T> RetryHook<T> ofAsync(AsyncRetryCallback<T> callback) {
        return new Suspending<>(callback);
    }

    static <T> RetryHook<T> ofAsync(Function<? super RetryResult<T>, ? extends CompletionStage<?>> callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        return new Suspending<>((result, context) -> callback.apply(result));
    }
}
