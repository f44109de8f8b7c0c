package org.javai.retry;

import org.javai.retry.exception.CallbackException;
import org.javai.retry.exception.FailureCallbackException;
import org.javai.retry.exception.RetryCallbackException;
import org.javai.retry.exception.SuccessCallbackException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Ordered retry, success and failure callbacks of one task.
 *
 * <p>Callbacks of a category run one after another in registration order. The first one to
 * fail stops the rest, and its failure is wrapped in the category's {@link CallbackException}.
 */
final class CallbackRegistry<T> {

    enum Category {
        RETRY(RetryCallbackException::new),
        SUCCESS(SuccessCallbackException::new),
        FAILURE(FailureCallbackException::new);

        private final Function<Throwable, CallbackException> wrapper;

        Category(Function<Throwable, CallbackException> wrapper) {
            this.wrapper = wrapper;
        }

        /**
         * Wraps a callback failure in this category's exception. Unrecoverable errors are
         * rethrown unwrapped instead.
         */
        CallbackException wrap(Throwable error) {
            Throwable cause = Throwables.unwrap(error);
            Throwables.rethrowIfUnrecoverable(cause);
            return wrapper.apply(cause);
        }
    }

    private final List<RetryHook<T>> retryHooks;
    private final List<RetryHook<T>> successHooks;
    private final List<RetryHook<T>> failureHooks;

    CallbackRegistry() {
        this(new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    private CallbackRegistry(List<RetryHook<T>> retryHooks, List<RetryHook<T>> successHooks,
                             List<RetryHook<T>> failureHooks) {
        this.retryHooks = retryHooks;
        this.successHooks = successHooks;
        this.failureHooks = failureHooks;
    }

    void add(Category category, RetryHook<T> hook) {
        hooks(category).add(Objects.requireNonNull(hook, "hook must not be null"));
    }

    int size(Category category) {
        return hooks(category).size();
    }

    /**
     * An independent registry holding the same callbacks, in the same order.
     */
    CallbackRegistry<T> copy() {
        return new CallbackRegistry<>(new ArrayList<>(retryHooks), new ArrayList<>(successHooks),
                new ArrayList<>(failureHooks));
    }

    /**
     * Runs the callbacks of a category on the calling thread, waiting for asynchronous ones.
     * Unrecoverable errors are not wrapped and propagate to the caller.
     *
     * @throws CallbackException wrapping the first callback failure
     */
    void invoke(Category category, RetryResult<T> result, RetryContext context) {
        for (RetryHook<T> hook : hooks(category)) {
            try {
                if (hook instanceof RetryHook.Sync<T> sync) {
                    sync.callback().accept(result, context);
                } else if (hook instanceof RetryHook.Suspending<T> suspending) {
                    suspending.callback().apply(result, context).toCompletableFuture().join();
                }
            } catch (Throwable t) {
                throw category.wrap(t);
            }
        }
    }

    /**
     * Runs the callbacks of a category one after another without blocking.
     *
     * @return a stage completing when the last callback finished, or exceptionally with a
     *         {@link CallbackException} wrapping the first callback failure
     */
    CompletableFuture<Void> invokeAsync(Category category, RetryResult<T> result, RetryContext context) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (RetryHook<T> hook : hooks(category)) {
            chain = chain.thenCompose(ignored -> start(hook, result, context));
        }
        return chain.handle((ignored, error) -> {
            if (error == null) {
                return null;
            }
            throw category.wrap(error);
        });
    }

    private CompletableFuture<Void> start(RetryHook<T> hook, RetryResult<T> result, RetryContext context) {
        try {
            if (hook instanceof RetryHook.Sync<T> sync) {
                sync.callback().accept(result, context);
                return CompletableFuture.completedFuture(null);
            }
            RetryHook.Suspending<T> suspending = (RetryHook.Suspending<T>) hook;
            CompletionStage<?> stage = Objects.requireNonNull(suspending.callback().apply(result, context),
                    "asynchronous callback returned null");
            return stage.toCompletableFuture().thenApply(ignored -> null);
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private List<RetryHook<T>> hooks(Category category) {
        return switch (category) {
            case RETRY -> retryHooks;
            case SUCCESS -> successHooks;
            case FAILURE -> failureHooks;
        };
    }
}
