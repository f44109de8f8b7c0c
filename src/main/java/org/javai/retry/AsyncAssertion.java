package org.javai.retry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Predicate;

/**
 * Asynchronous acceptance condition. Completing with {@code false} asks for another attempt;
 * completing exceptionally ends the execution with an
 * {@link org.javai.retry.exception.AssertCallbackException}.
 *
 * @param <T> The type of the operation's result
 */
@FunctionalInterface
public interface AsyncAssertion<T> {

    CompletionStage<Boolean> test(RetryResult<T> result);

    static <T> AsyncAssertion<T> of(Predicate<? super RetryResult<T>> condition) {
        Objects.requireNonNull(condition, "condition must not be null");
        return result -> CompletableFuture.completedFuture(condition.test(result));
    }
}
