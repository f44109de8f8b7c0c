package org.javai.retry;

import org.javai.retry.CallbackRegistry.Category;
import org.javai.retry.classify.ExceptionClassifier;
import org.javai.retry.exception.AssertCallbackException;
import org.javai.retry.exception.CallbackException;
import org.javai.retry.ops.RetryReporter;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Asynchronous retry execution built on {@link CompletableFuture}.
 *
 * <p>Follows exactly the same state machine as {@link RetryTask}; the difference is that waits
 * between attempts, the operation and asynchronous callbacks suspend instead of blocking, and
 * that a {@link CancellationToken} is honoured before and during every wait and after every
 * unsuccessful attempt. Cancelling during a wait drops the pending timer and resumes on the
 * execution's executor right away.
 *
 * @param <T> The type of the operation's result
 */
public final class AsyncRetryTask<T> implements AsyncRetriable<T> {

    private enum Step { PROCEED, RETRY, STOP, SUCCEEDED }

    private final String name;
    private final Supplier<? extends CompletionStage<T>> operation;
    private final RetryOptions options;
    private final Set<Class<? extends Throwable>> retryOn;
    private final ExceptionClassifier classifier;
    private final RetryReporter reporter;
    private final Executor executor;
    private final Clock clock;
    private final CallbackRegistry<T> callbacks;

    /**
     * Creates a task with the default classifier, no reporting, and the common pool as executor.
     *
     * @param operation Starts one attempt; the attempt fails if the stage completes exceptionally
     * @param options Bounds and backoff
     * @param retryOn Exception types worth retrying; empty retries on any exception
     */
    public AsyncRetryTask(Supplier<? extends CompletionStage<T>> operation, RetryOptions options,
                          Set<Class<? extends Throwable>> retryOn) {
        this(RetryTask.DEFAULT_NAME, operation, options, retryOn, ExceptionClassifier.defaultClassifier(),
                RetryReporter.noOp(), ForkJoinPool.commonPool(), Clock.systemUTC(), new CallbackRegistry<>());
    }

    AsyncRetryTask(String name, Supplier<? extends CompletionStage<T>> operation, RetryOptions options,
                   Set<Class<? extends Throwable>> retryOn, ExceptionClassifier classifier, RetryReporter reporter,
                   Executor executor, Clock clock, CallbackRegistry<T> callbacks) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.retryOn = Set.copyOf(Objects.requireNonNull(retryOn, "retryOn must not be null"));
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks must not be null");
    }

    @Override
    public CompletableFuture<RetryResult<T>> runAsyncUntil(AsyncAssertion<T> condition,
                                                           CancellationToken cancellation, Executor resumeOn) {
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        Objects.requireNonNull(resumeOn, "resumeOn must not be null");
        return new Execution(condition, cancellation, resumeOn).start();
    }

    @Override
    public CompletableFuture<RetryResult<T>> runAsyncUntil(AsyncAssertion<T> condition,
                                                           CancellationToken cancellation) {
        return runAsyncUntil(condition, cancellation, executor);
    }

    @Override
    public AsyncRetriable<T> onRetry(RetryHook<T> hook) {
        callbacks.add(Category.RETRY, hook);
        return this;
    }

    @Override
    public AsyncRetriable<T> onSuccess(RetryHook<T> hook) {
        callbacks.add(Category.SUCCESS, hook);
        return this;
    }

    @Override
    public AsyncRetriable<T> onFailure(RetryHook<T> hook) {
        callbacks.add(Category.FAILURE, hook);
        return this;
    }

    public String name() {
        return name;
    }

    public RetryOptions options() {
        return options;
    }

    /**
     * State of one run. Stages are chained strictly one after another, so the tracker and the
     * result are never touched by two threads at once.
     */
    private final class Execution {

        private final AsyncAssertion<T> condition;
        private final CancellationToken cancellation;
        private final Executor resumeOn;
        private final RetryTracker tracker = new RetryTracker(clock);
        private final RetryResult<T> result = new RetryResult<>();
        private final CompletableFuture<RetryResult<T>> completion = new CompletableFuture<>();

        Execution(AsyncAssertion<T> condition, CancellationToken cancellation, Executor resumeOn) {
            this.condition = condition;
            this.cancellation = cancellation;
            this.resumeOn = resumeOn;
        }

        CompletableFuture<RetryResult<T>> start() {
            next();
            return completion;
        }

        private void next() {
            attempt().whenComplete((step, error) -> {
                try {
                    if (error != null) {
                        completion.completeExceptionally(Throwables.unwrap(error));
                    } else if (step == Step.SUCCEEDED) {
                        reporter.reportSuccess(name, tracker.snapshot());
                        completion.complete(result);
                    } else if (step == Step.RETRY && tracker.shouldContinue(result, options, cancellation)) {
                        next();
                    } else {
                        fail();
                    }
                } catch (Throwable t) {
                    completion.completeExceptionally(t);
                }
            });
        }

        private CompletableFuture<Step> attempt() {
            if (!tracker.beginAttempt()) {
                return invokeOperation();
            }

            return callbacks.invokeAsync(Category.RETRY, result, tracker.snapshot())
                    .handle((ignored, error) -> error == null ? Step.PROCEED : record(error))
                    .thenCompose(step -> step == Step.PROCEED ? waitForRetry() : completed(step))
                    .thenCompose(step -> step == Step.PROCEED ? invokeOperation() : completed(step));
        }

        private CompletableFuture<Step> waitForRetry() {
            if (cancellation.isCancellationRequested()) {
                result.setError(new CancellationException("Retry cancelled before attempt " + tracker.triedCount()));
                return completed(Step.STOP);
            }

            Duration delay = options.retryInterval().getInterval();
            reporter.reportRetryAttempt(name, tracker.snapshot(), delay);

            CompletableFuture<Step> wait = new CompletableFuture<>();
            ScheduledFuture<?> timer = RetryTimer.schedule(() -> wait.complete(Step.PROCEED), delay);
            CancellationToken.Registration registration = cancellation.onCancel(() -> {
                wait.complete(Step.STOP);
                timer.cancel(false);
            });

            return wait.thenApplyAsync(step -> {
                registration.unregister();
                if (step == Step.STOP) {
                    result.setError(new CancellationException(
                            "Retry cancelled while waiting for attempt " + tracker.triedCount()));
                }
                return step;
            }, resumeOn);
        }

        private CompletableFuture<Step> invokeOperation() {
            CompletableFuture<T> call;
            try {
                call = Objects.requireNonNull(operation.get(), "operation returned null").toCompletableFuture();
            } catch (Throwable t) {
                call = CompletableFuture.failedFuture(t);
            }
            return call.handleAsync(this::onAttemptCompleted, resumeOn).thenCompose(Function.identity());
        }

        private CompletableFuture<Step> onAttemptCompleted(T value, Throwable error) {
            if (error != null) {
                Throwable cause = Throwables.unwrap(error);
                if (classifier.isRetryable(cause, retryOn)) {
                    return completed(Step.RETRY);
                }
                result.setError(cause);
                return completed(Step.STOP);
            }

            result.setResult(value);
            return condition == null ? onAccepted() : evaluateCondition();
        }

        private CompletableFuture<Step> evaluateCondition() {
            CompletableFuture<Boolean> verdict;
            try {
                verdict = Objects.requireNonNull(condition.test(result), "condition returned null")
                        .toCompletableFuture();
            } catch (Throwable t) {
                verdict = CompletableFuture.failedFuture(t);
            }

            return verdict.<CompletableFuture<Step>>handle((accepted, error) -> {
                if (error != null) {
                    Throwable cause = Throwables.unwrap(error);
                    Throwables.rethrowIfUnrecoverable(cause);
                    result.setError(new AssertCallbackException(cause));
                    return completed(Step.STOP);
                }
                return Boolean.TRUE.equals(accepted) ? onAccepted() : completed(Step.RETRY);
            }).thenCompose(Function.identity());
        }

        private CompletableFuture<Step> onAccepted() {
            return callbacks.invokeAsync(Category.SUCCESS, result, tracker.snapshot())
                    .handle((ignored, error) -> error == null ? Step.SUCCEEDED : record(error));
        }

        private void fail() {
            callbacks.invokeAsync(Category.FAILURE, result, tracker.snapshot())
                    .whenComplete((ignored, error) -> {
                        try {
                            if (error != null) {
                                // Replaces the terminal error determined earlier.
                                record(error);
                            }
                            reporter.reportFailure(name, result.error(), tracker.snapshot());
                            completion.complete(result);
                        } catch (Throwable t) {
                            completion.completeExceptionally(Throwables.unwrap(t));
                        }
                    });
        }

        /**
         * Records a callback failure as the terminal error. Anything else reaching here is an
         * unrecoverable error and is rethrown.
         */
        private Step record(Throwable error) {
            Throwable cause = Throwables.unwrap(error);
            if (!(cause instanceof CallbackException)) {
                throw new CompletionException(cause);
            }
            result.setError(cause);
            return Step.STOP;
        }
    }

    private static <S> CompletableFuture<S> completed(S value) {
        return CompletableFuture.completedFuture(value);
    }
}
